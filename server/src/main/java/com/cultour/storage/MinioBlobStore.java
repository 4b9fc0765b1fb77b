package com.cultour.storage;

import com.cultour.common.status.Status;
import com.cultour.common.status.StatusOr;
import com.cultour.config.MinioConfig;
import io.minio.BucketExistsArgs;
import io.minio.MakeBucketArgs;
import io.minio.MinioClient;
import io.minio.PutObjectArgs;
import io.minio.errors.ErrorResponseException;
import io.minio.errors.InsufficientDataException;
import io.minio.errors.InternalException;
import io.minio.errors.InvalidResponseException;
import io.minio.errors.ServerException;
import io.minio.errors.XmlParserException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.security.InvalidKeyException;
import java.security.NoSuchAlgorithmException;
import org.tinylog.Logger;

/** {@link BlobStore} backed by a MinIO bucket. */
public class MinioBlobStore implements BlobStore {

  private final MinioConfig config;
  private final MinioClient client;

  public MinioBlobStore(MinioConfig config, MinioClient client) {
    this.config = config;
    this.client = client;
  }

  public static MinioBlobStore create(MinioConfig config) {
    MinioClient client =
        MinioClient.builder()
            .endpoint(config.endpoint())
            .credentials(config.accessKey(), config.secretKey())
            .build();
    return new MinioBlobStore(config, client);
  }

  /** Creates the bucket when it is missing. Failures are logged; uploads will report them. */
  public void ensureBucket() {
    try {
      boolean exists =
          client.bucketExists(BucketExistsArgs.builder().bucket(config.bucket()).build());
      if (exists) {
        Logger.info("Found image bucket {}.", config.bucket());
      } else {
        client.makeBucket(MakeBucketArgs.builder().bucket(config.bucket()).build());
        Logger.info("Image bucket {} was created.", config.bucket());
      }
    } catch (ErrorResponseException
        | InsufficientDataException
        | InternalException
        | InvalidKeyException
        | InvalidResponseException
        | IOException
        | NoSuchAlgorithmException
        | ServerException
        | XmlParserException e) {
      Logger.error(e, "Unexpected failure checking image bucket {}.", config.bucket());
    }
  }

  @Override
  public StatusOr<String> put(String key, BlobUpload upload) {
    try (ByteArrayInputStream stream = new ByteArrayInputStream(upload.content())) {
      client.putObject(
          PutObjectArgs.builder()
              .bucket(config.bucket())
              .object(key)
              .stream(stream, upload.size(), -1)
              .contentType(upload.contentType())
              .build());
    } catch (ErrorResponseException
        | InsufficientDataException
        | InternalException
        | InvalidKeyException
        | InvalidResponseException
        | IOException
        | NoSuchAlgorithmException
        | ServerException
        | XmlParserException e) {
      Logger.error(e, "Failed to store object {} in bucket {}.", key, config.bucket());
      return StatusOr.ofStatus(Status.unavailable("failed to store " + key, e));
    }
    Logger.debug("Stored {} ({} bytes) in bucket {}.", key, upload.size(), config.bucket());
    return StatusOr.ofValue(config.objectUrl(key));
  }
}
