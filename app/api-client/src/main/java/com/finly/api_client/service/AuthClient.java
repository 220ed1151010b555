/*
 * どこで: API クライアントのサービス層
 * 何を: サインアップ・ログイン・メール確認・ログアウトなど認証 API を呼び出す
 * なぜ: 取得したトークンとユーザー情報の保存・破棄を一箇所に集約するため
 */
package com.finly.api_client.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.finly.api_client.config.AuthEndpointProperties;
import com.finly.api_client.model.AuthResult;
import com.finly.api_client.model.AuthUser;
import com.finly.api_client.model.RequestOptions;
import com.finly.common.store.PersistentKeyValueStore;
import java.util.Map;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;

@RequiredArgsConstructor
public class AuthClient {

  private static final Logger logger = LoggerFactory.getLogger(AuthClient.class);

  private final RequestPipeline pipeline;
  private final TokenManager tokenManager;
  private final CacheStore cacheStore;
  private final PersistentKeyValueStore store;
  private final AuthEndpointProperties paths;
  private final ObjectMapper objectMapper;

  /** Creates an unverified account; tokens are issued only after {@link #verifyEmail}. */
  public AuthUser signup(String name, String email, String password) {
    requireText(name, "name");
    requireText(email, "email");
    requireText(password, "password");
    final JsonNode data =
        post(paths.signupPath(), Map.of("name", name, "email", email, "password", password));
    return convert(data.path("user"), AuthUser.class);
  }

  public AuthResult verifyEmail(String email, String otp) {
    requireText(email, "email");
    requireText(otp, "otp");
    return establishSession(post(paths.verifyEmailPath(), Map.of("email", email, "otp", otp)));
  }

  public void resendVerification(String email) {
    requireText(email, "email");
    post(paths.resendVerificationPath(), Map.of("email", email));
  }

  public AuthResult login(String email, String password) {
    requireText(email, "email");
    requireText(password, "password");
    return establishSession(post(paths.loginPath(), Map.of("email", email, "password", password)));
  }

  public void forgotPassword(String email) {
    requireText(email, "email");
    post(paths.forgotPasswordPath(), Map.of("email", email));
  }

  public void resetPassword(String email, String otp, String newPassword) {
    requireText(email, "email");
    requireText(otp, "otp");
    requireText(newPassword, "newPassword");
    post(
        paths.resetPasswordPath(), Map.of("email", email, "otp", otp, "newPassword", newPassword));
  }

  /** Tells the backend to revoke the session, then always drops local tokens and cache. */
  public void logout() {
    try {
      post(paths.logoutPath(), null);
    } catch (ApiClientException ex) {
      logger.warn("logout request failed reason={} status={}", ex.reason(), ex.status());
    } finally {
      tokenManager.clearTokens();
      cacheStore.clear();
    }
    logger.info("logged out");
  }

  public AuthUser currentUser() {
    final JsonNode data =
        pipeline.getNode(paths.currentUserPath(), RequestOptions.defaults().skippingCache());
    final JsonNode user = data.path("user");
    final AuthUser converted = convert(user, AuthUser.class);
    store.set(StorageKeys.USER_DATA, user.toString());
    return converted;
  }

  public boolean isAuthenticated() {
    return tokenManager.hasSession();
  }

  /** User saved by the last login or {@link #currentUser()}, without a network call. */
  public Optional<AuthUser> cachedUser() {
    final Optional<String> raw = store.get(StorageKeys.USER_DATA);
    if (raw.isEmpty()) {
      return Optional.empty();
    }
    try {
      return Optional.of(objectMapper.readValue(raw.get(), AuthUser.class));
    } catch (JsonProcessingException ex) {
      logger.warn("cached user data unreadable, dropping it", ex);
      store.delete(StorageKeys.USER_DATA);
      return Optional.empty();
    }
  }

  private JsonNode post(String path, Object body) {
    return pipeline.send(HttpMethod.POST, path, body, RequestOptions.defaults());
  }

  private AuthResult establishSession(JsonNode data) {
    final AuthResult result = convert(data, AuthResult.class);
    if (result.tokens() == null || result.user() == null) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE, "auth response has no session");
    }
    tokenManager.storeTokens(result.tokens());
    store.set(StorageKeys.USER_DATA, data.path("user").toString());
    logger.info("session established userId={}", result.user().id());
    return result;
  }

  private <T> T convert(JsonNode node, Class<T> type) {
    if (node == null || node.isMissingNode() || node.isNull()) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE,
          "auth response has no " + type.getSimpleName());
    }
    try {
      return objectMapper.convertValue(node, type);
    } catch (IllegalArgumentException ex) {
      throw new ApiClientException(
          ApiClientException.Reason.INVALID_RESPONSE, "auth response is invalid", ex);
    }
  }

  private void requireText(String value, String name) {
    if (value == null || value.isBlank()) {
      throw new IllegalArgumentException(name + " is required");
    }
  }
}
