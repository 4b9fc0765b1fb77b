package com.cultour.rest;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonSyntaxException;
import com.google.gson.TypeAdapter;
import com.google.gson.stream.JsonReader;
import com.google.gson.stream.JsonToken;
import com.google.gson.stream.JsonWriter;
import io.javalin.json.JsonMapper;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.lang.reflect.Type;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import javax.annotation.Nonnull;

/** Javalin {@link JsonMapper} backed by Gson. Instants are written as ISO-8601 strings. */
public class GsonJsonMapper implements JsonMapper {

  private final Gson gson;

  public GsonJsonMapper() {
    this(newGson());
  }

  public GsonJsonMapper(Gson gson) {
    this.gson = gson;
  }

  /** The Gson configuration used for request and response bodies. */
  public static Gson newGson() {
    return new GsonBuilder().registerTypeAdapter(Instant.class, new InstantAdapter()).create();
  }

  @Nonnull
  @Override
  public String toJsonString(@Nonnull Object obj, @Nonnull Type type) {
    return gson.toJson(obj, type);
  }

  @Nonnull
  @Override
  public <T> T fromJsonString(@Nonnull String json, @Nonnull Type targetType) {
    return gson.fromJson(json, targetType);
  }

  @Nonnull
  @Override
  public <T> T fromJsonStream(@Nonnull InputStream json, @Nonnull Type targetType) {
    return gson.fromJson(new InputStreamReader(json, StandardCharsets.UTF_8), targetType);
  }

  static final class InstantAdapter extends TypeAdapter<Instant> {
    @Override
    public void write(JsonWriter out, Instant value) throws IOException {
      if (value == null) {
        out.nullValue();
      } else {
        out.value(value.toString());
      }
    }

    @Override
    public Instant read(JsonReader in) throws IOException {
      if (in.peek() == JsonToken.NULL) {
        in.nextNull();
        return null;
      }
      String text = in.nextString();
      try {
        return Instant.parse(text);
      } catch (DateTimeParseException e) {
        throw new JsonSyntaxException("not an ISO-8601 instant: " + text, e);
      }
    }
  }
}
