package com.finly.api_client.service;

import java.util.List;

public final class StorageKeys {

  public static final String ACCESS_TOKEN = "finly_access_token";
  public static final String REFRESH_TOKEN = "finly_refresh_token";
  public static final String USER_DATA = "finly_user_data";
  public static final String TOKEN_EXPIRY = "finly_token_expiry";
  public static final String CACHE_PREFIX = "api_cache:";

  public static final List<String> SESSION_KEYS =
      List.of(ACCESS_TOKEN, REFRESH_TOKEN, USER_DATA, TOKEN_EXPIRY);

  private StorageKeys() {}
}
