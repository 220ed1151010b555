/*
 * どこで: API クライアントの永続化層
 * 何を: トークンとキャッシュ応答を Redis の文字列キーとして保存する
 * なぜ: 複数プロセスでセッションとキャッシュを共有できるようにするため
 */
package com.finly.api_client.store;

import com.finly.common.store.PersistentKeyValueStore;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.util.Collection;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.data.redis.core.StringRedisTemplate;

public class RedisKeyValueStore implements PersistentKeyValueStore {

  @SuppressFBWarnings(
      value = "EI_EXPOSE_REP2",
      justification = "StringRedisTemplate は Spring 管理の共有コンポーネントで防御的コピーが不可能なため")
  private final StringRedisTemplate redisTemplate;

  private final String namespace;

  public RedisKeyValueStore(StringRedisTemplate redisTemplate, String namespace) {
    this.redisTemplate = redisTemplate;
    this.namespace = namespace == null ? "" : namespace;
  }

  @Override
  public Optional<String> get(String key) {
    return Optional.ofNullable(redisTemplate.opsForValue().get(redisKey(key)));
  }

  @Override
  public void set(String key, String value) {
    if (value == null) {
      throw new IllegalArgumentException("value is required");
    }
    redisTemplate.opsForValue().set(redisKey(key), value);
  }

  @Override
  public void delete(String key) {
    redisTemplate.delete(redisKey(key));
  }

  @Override
  public void deleteMany(Collection<String> keys) {
    if (keys == null || keys.isEmpty()) {
      return;
    }
    redisTemplate.delete(keys.stream().map(this::redisKey).toList());
  }

  @Override
  public Set<String> keys(String prefix) {
    final String pattern = escapeGlob(namespace + (prefix == null ? "" : prefix)) + "*";
    final Set<String> found = redisTemplate.keys(pattern);
    if (found == null) {
      return Set.of();
    }
    return found.stream()
        .filter(key -> key.startsWith(namespace))
        .map(key -> key.substring(namespace.length()))
        .collect(Collectors.toUnmodifiableSet());
  }

  private String redisKey(String key) {
    if (key == null || key.isBlank()) {
      throw new IllegalArgumentException("key is required");
    }
    return namespace + key;
  }

  // KEYS のパターン文字はリテラルとして扱う
  static String escapeGlob(String value) {
    final StringBuilder escaped = new StringBuilder(value.length());
    for (int i = 0; i < value.length(); i++) {
      final char c = value.charAt(i);
      if (c == '*' || c == '?' || c == '[' || c == ']' || c == '\\') {
        escaped.append('\\');
      }
      escaped.append(c);
    }
    return escaped.toString();
  }
}
