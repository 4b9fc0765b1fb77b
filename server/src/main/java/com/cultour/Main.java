package com.cultour;

import com.cultour.config.DirectoryConfig;
import com.cultour.config.MinioConfig;
import com.cultour.query.QueryDefaults;
import com.cultour.repository.BadgeRepository;
import com.cultour.repository.UserBadgeRepository;
import com.cultour.repository.UserProfileRepository;
import com.cultour.repository.UserRepository;
import com.cultour.repository.directory.DirectoryUserRepository;
import com.cultour.repository.directory.GoTrueDirectoryClient;
import com.cultour.repository.table.BadgeTableRepository;
import com.cultour.repository.table.UserBadgeTableRepository;
import com.cultour.repository.table.UserProfileTableRepository;
import com.cultour.rest.GsonJsonMapper;
import com.cultour.rest.RestAdapterFactory;
import com.cultour.service.BadgeAwarder;
import com.cultour.service.BadgeRuleTable;
import com.cultour.service.BadgeService;
import com.cultour.service.UserBadgeService;
import com.cultour.service.UserProfileService;
import com.cultour.service.UserService;
import com.cultour.storage.MinioBlobStore;
import com.google.common.base.Strings;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import io.javalin.openapi.OpenApiInfo;
import io.javalin.openapi.OpenApiServer;
import io.javalin.openapi.plugin.OpenApiPlugin;
import io.javalin.openapi.plugin.redoc.ReDocPlugin;
import io.javalin.openapi.plugin.swagger.SwaggerPlugin;
import io.javalin.plugin.bundled.CorsPluginConfig.CorsRule;
import org.tinylog.Logger;

/**
 * Entry point of the Cultour user service.
 *
 * <p>Wires the table store, the user directory and the image bucket into the services and exposes
 * them over REST. All settings come from environment variables:
 *
 * <ul>
 *   <li>{@code DB_URL}, {@code DB_USER}, {@code DB_PASSWORD}
 *   <li>{@code DIRECTORY_URL}, {@code DIRECTORY_SERVICE_KEY}, {@code DIRECTORY_SCAN_PAGE_SIZE}
 *   <li>{@code MINIO_ENDPOINT}, {@code MINIO_ACCESS_KEY}, {@code MINIO_SECRET_KEY},
 *       {@code MINIO_BUCKET}, {@code MINIO_PUBLIC_URL}
 *   <li>{@code QUERY_DEFAULT_PER_PAGE}, {@code QUERY_MAX_PER_PAGE}, {@code QUERY_DEFAULT_SORT_BY}
 *   <li>{@code BADGE_EXPLORER_NAME}, {@code BADGE_VERIFIED_NAME}
 *   <li>{@code REST_PORT}
 * </ul>
 */
public class Main {

  private static final int DEFAULT_REST_PORT = 8080;

  private final HikariDataSource dataSource;
  private final int restPort;

  private final UserService userService;
  private final UserProfileService profileService;
  private final BadgeService badgeService;
  private final UserBadgeService userBadgeService;

  public Main() {
    this.restPort = intEnv("REST_PORT", DEFAULT_REST_PORT);

    // Initialize database connection pool
    this.dataSource = setupDataSource();

    var queryDefaults =
        new QueryDefaults(
            intEnv("QUERY_DEFAULT_PER_PAGE", QueryDefaults.DEFAULT_PER_PAGE),
            intEnv("QUERY_MAX_PER_PAGE", QueryDefaults.MAX_PER_PAGE),
            stringEnv("QUERY_DEFAULT_SORT_BY", QueryDefaults.DEFAULT_SORT_BY));
    Logger.info("Query defaults: {}", queryDefaults);

    var directoryConfig =
        new DirectoryConfig(
            System.getenv("DIRECTORY_URL"),
            System.getenv("DIRECTORY_SERVICE_KEY"),
            intEnv("DIRECTORY_SCAN_PAGE_SIZE", DirectoryConfig.DEFAULT_SCAN_PAGE_SIZE));
    Logger.info("Configured user directory: {}", directoryConfig.toSecureString());

    var minioConfig =
        new MinioConfig(
            System.getenv("MINIO_ENDPOINT"),
            System.getenv("MINIO_ACCESS_KEY"),
            System.getenv("MINIO_SECRET_KEY"),
            System.getenv("MINIO_BUCKET"),
            stringEnv("MINIO_PUBLIC_URL", ""));
    Logger.info("Configured MinIO: {}", minioConfig.toSecureString());
    MinioBlobStore blobStore = MinioBlobStore.create(minioConfig);
    blobStore.ensureBucket();

    var badgeRules =
        BadgeRuleTable.of(
            stringEnv("BADGE_EXPLORER_NAME", BadgeRuleTable.DEFAULT_EXPLORER_BADGE),
            stringEnv("BADGE_VERIFIED_NAME", BadgeRuleTable.DEFAULT_VERIFIED_LOCAL_BADGE));
    Logger.info("Badge rules: {}", badgeRules);

    // Repositories
    UserRepository users =
        new DirectoryUserRepository(
            new GoTrueDirectoryClient(directoryConfig),
            queryDefaults,
            directoryConfig.scanPageSize());
    UserProfileRepository profiles = new UserProfileTableRepository(dataSource, queryDefaults);
    BadgeRepository badges = new BadgeTableRepository(dataSource, queryDefaults);
    UserBadgeRepository userBadges = new UserBadgeTableRepository(dataSource, queryDefaults);

    // Services
    var awarder = new BadgeAwarder(new BadgeAwarder.Config(badgeRules, badges, userBadges));
    this.userService = new UserService(new UserService.Config(users, queryDefaults));
    this.profileService =
        new UserProfileService(
            new UserProfileService.Config(
                profiles,
                users,
                awarder,
                blobStore,
                queryDefaults,
                UserProfileService.DEFAULT_MAX_UPLOAD_BYTES));
    this.badgeService = new BadgeService(new BadgeService.Config(badges, queryDefaults));
    this.userBadgeService =
        new UserBadgeService(
            new UserBadgeService.Config(userBadges, users, badges, queryDefaults));
  }

  /**
   * Sets up the HikariCP connection pool from the {@code DB_*} environment variables.
   *
   * @return A configured HikariDataSource for database connections
   */
  private HikariDataSource setupDataSource() {
    String dbUrl = System.getenv("DB_URL");
    String dbUser = System.getenv("DB_USER");
    String dbPassword = System.getenv("DB_PASSWORD");

    HikariConfig config = new HikariConfig();
    config.setJdbcUrl(dbUrl);
    config.setUsername(dbUser);
    config.setPassword(dbPassword);
    config.setMaximumPoolSize(10);
    config.setMinimumIdle(2);
    config.setIdleTimeout(30000);
    config.setMaxLifetime(1800000);
    config.setConnectionTimeout(30000);
    config.setAutoCommit(true);
    config.setPoolName("CultourPool");
    config.addDataSourceProperty("cachePrepStmts", "true");
    config.addDataSourceProperty("prepStmtCacheSize", "250");
    config.addDataSourceProperty("prepStmtCacheSqlLimit", "2048");

    Logger.info("Initializing database connection pool with URL: {} and user {}", dbUrl, dbUser);
    return new HikariDataSource(config);
  }

  private void shutdown() {
    if (dataSource != null && !dataSource.isClosed()) {
      Logger.info("Shutting down database connection pool");
      dataSource.close();
    }
  }

  private OpenApiInfo getOpenApiInfo(OpenApiInfo openApiInfo) {
    return openApiInfo
        .title("Cultour User API")
        .description(
            "Users, their profiles and the badges they collect while exploring. List endpoints"
                + " share one query model: paging, sorting, free-text search and typed filters.")
        .version("v1");
  }

  private OpenApiServer getOpenApiServer(OpenApiServer openApiServer) {
    return openApiServer
        .description("Cultour REST API server endpoint")
        .url("http://localhost:{port}")
        .variable("port", "Server's REST port", String.valueOf(restPort), String.valueOf(restPort));
  }

  public void startJavalinServer() {
    var restAdapterFactory =
        new RestAdapterFactory(userService, profileService, badgeService, userBadgeService);

    // Note: redoc is available at /openapi
    Javalin app =
        Javalin.create(
            config -> {
              config.jsonMapper(new GsonJsonMapper());
              config.bundledPlugins.enableCors(cors -> cors.addRule(CorsRule::anyHost));
              config.registerPlugin(
                  new OpenApiPlugin(
                      openApiConfig ->
                          openApiConfig
                              .withPrettyOutput()
                              .withDefinitionConfiguration(
                                  (version, openApiDefinition) ->
                                      openApiDefinition
                                          .withInfo(this::getOpenApiInfo)
                                          .withServer(this::getOpenApiServer))));

              config.registerPlugin(
                  new ReDocPlugin(
                      reDocConfiguration -> reDocConfiguration.setDocumentationPath("/openapi")));

              config.registerPlugin(
                  new SwaggerPlugin(
                      swaggerConfiguration ->
                          swaggerConfiguration.setDocumentationPath("/openapi")));

              restAdapterFactory.configureRoutes(config.router);
            });

    Runtime.getRuntime()
        .addShutdownHook(
            new Thread(
                () -> {
                  Logger.info("Shutting down server since JVM is shutting down");
                  try {
                    app.stop();
                    Main.this.shutdown();
                  } catch (Exception e) {
                    Logger.error(e, "Error during shutdown.");
                  }
                }));

    app.start(restPort);
    Logger.info("REST server started, listening on port {}.", restPort);
  }

  private static String stringEnv(String name, String defaultValue) {
    String value = System.getenv(name);
    return Strings.isNullOrEmpty(value) ? defaultValue : value;
  }

  private static int intEnv(String name, int defaultValue) {
    String value = System.getenv(name);
    if (Strings.isNullOrEmpty(value)) {
      return defaultValue;
    }
    try {
      return Integer.parseInt(value.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException(name + " must be an integer, got '" + value + "'", e);
    }
  }

  public static void main(String[] args) {
    Main server = new Main();
    server.startJavalinServer();
  }
}
