package com.cultour.rest;

import static io.javalin.apibuilder.ApiBuilder.delete;
import static io.javalin.apibuilder.ApiBuilder.get;
import static io.javalin.apibuilder.ApiBuilder.path;
import static io.javalin.apibuilder.ApiBuilder.post;
import static io.javalin.apibuilder.ApiBuilder.put;

import com.cultour.service.BadgeService;
import com.cultour.service.UserBadgeService;
import com.cultour.service.UserProfileService;
import com.cultour.service.UserService;
import io.javalin.config.RouterConfig;

/** Creates the REST adapters and binds them to their routes. */
public class RestAdapterFactory {

  private final UserServiceRestAdapter userAdapter;
  private final UserProfileServiceRestAdapter profileAdapter;
  private final BadgeServiceRestAdapter badgeAdapter;
  private final UserBadgeServiceRestAdapter userBadgeAdapter;

  public RestAdapterFactory(
      UserService userService,
      UserProfileService profileService,
      BadgeService badgeService,
      UserBadgeService userBadgeService) {
    this.userAdapter = new UserServiceRestAdapter(userService);
    this.profileAdapter = new UserProfileServiceRestAdapter(profileService);
    this.badgeAdapter = new BadgeServiceRestAdapter(badgeService);
    this.userBadgeAdapter = new UserBadgeServiceRestAdapter(userBadgeService);
  }

  public void configureRoutes(RouterConfig router) {
    router.apiBuilder(
        () -> {
          // User endpoints, with the user's profile and badges nested below
          path(
              "/v1/users",
              () -> {
                post(userAdapter::handleCreateUser);
                get(userAdapter::handleListUsers);
                path(
                    "{id}",
                    () -> {
                      get(userAdapter::handleGetUser);
                      put(userAdapter::handleUpdateUser);
                      delete(userAdapter::handleDeleteUser);
                      get("profile", profileAdapter::handleGetProfileByUser);
                      path(
                          "badges",
                          () -> {
                            get(userBadgeAdapter::handleListUserBadges);
                            post(userBadgeAdapter::handleGrantBadge);
                          });
                    });
              });

          // Profile endpoints
          path(
              "/v1/profiles",
              () -> {
                post(profileAdapter::handleCreateProfile);
                get(profileAdapter::handleListProfiles);
                get("search", profileAdapter::handleSearchProfiles);
                path(
                    "{id}",
                    () -> {
                      get(profileAdapter::handleGetProfile);
                      put(profileAdapter::handleUpdateProfile);
                      delete(profileAdapter::handleDeleteProfile);
                      put("avatar", profileAdapter::handleUpdateAvatar);
                      put("identity", profileAdapter::handleVerifyIdentity);
                    });
              });

          // Badge endpoints
          path(
              "/v1/badges",
              () -> {
                post(badgeAdapter::handleCreateBadge);
                get(badgeAdapter::handleListBadges);
                get("popular", badgeAdapter::handlePopularBadges);
                path(
                    "{id}",
                    () -> {
                      get(badgeAdapter::handleGetBadge);
                      put(badgeAdapter::handleUpdateBadge);
                      delete(badgeAdapter::handleDeleteBadge);
                    });
              });

          // Badge grant endpoints
          path(
              "/v1/user-badges/{id}",
              () -> {
                get(userBadgeAdapter::handleGetUserBadge);
                delete(userBadgeAdapter::handleRevokeUserBadge);
              });
        });
  }
}
