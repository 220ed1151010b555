package com.finly.api_client.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyCollection;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

class RedisKeyValueStoreTest {

  @SuppressWarnings("unchecked")
  private final ValueOperations<String, String> valueOps = Mockito.mock(ValueOperations.class);

  private final StringRedisTemplate redisTemplate = Mockito.mock(StringRedisTemplate.class);
  private final RedisKeyValueStore store = new RedisKeyValueStore(redisTemplate, "finly:");

  @Test
  void readsAndWritesNamespacedKeys() {
    when(redisTemplate.opsForValue()).thenReturn(valueOps);
    when(valueOps.get("finly:finly_access_token")).thenReturn("access-1");

    store.set("finly_refresh_token", "refresh-1");

    assertThat(store.get("finly_access_token")).contains("access-1");
    assertThat(store.get("finly_user_data")).isEmpty();
    verify(valueOps).set("finly:finly_refresh_token", "refresh-1");
  }

  @Test
  void deletesNamespacedKeys() {
    store.delete("api_cache:tags");
    store.deleteMany(List.of("api_cache:expenses", "api_cache:income"));
    store.deleteMany(List.of());

    verify(redisTemplate).delete("finly:api_cache:tags");
    verify(redisTemplate).delete(List.of("finly:api_cache:expenses", "finly:api_cache:income"));
    verify(redisTemplate, never()).delete(List.<String>of());
  }

  @Test
  void keysMatchesEscapedPrefixAndStripsNamespace() {
    when(redisTemplate.keys("finly:api_cache:expenses\\?tag=7*"))
        .thenReturn(Set.of("finly:api_cache:expenses?tag=7", "finly:api_cache:expenses?tag=7&p=2"));

    final Set<String> keys = store.keys("api_cache:expenses?tag=7");

    assertThat(keys)
        .containsExactlyInAnyOrder("api_cache:expenses?tag=7", "api_cache:expenses?tag=7&p=2");
  }

  @Test
  void keysToleratesNullReply() {
    when(redisTemplate.keys("finly:api_cache:*")).thenReturn(null);

    assertThat(store.keys("api_cache:")).isEmpty();
  }

  @Test
  void rejectsBlankKeysAndNullValues() {
    assertThatThrownBy(() -> store.get(" "))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("key is required");
    assertThatThrownBy(() -> store.set("finly_user_data", null))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("value is required");
    verify(redisTemplate, never()).delete(anyCollection());
  }

  @Test
  void escapesGlobCharacters() {
    assertThat(RedisKeyValueStore.escapeGlob("a*b?c[d]e\\f")).isEqualTo("a\\*b\\?c\\[d\\]e\\\\f");
  }
}
