package com.finly.common.store;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.Test;

class InMemoryKeyValueStoreTest {

  @Test
  void setGetDelete() {
    final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    store.set("token", "abc");

    assertThat(store.get("token")).contains("abc");

    store.delete("token");

    assertThat(store.get("token")).isEmpty();
  }

  @Test
  void keysFiltersByPrefixAndDeleteManyRemovesThem() {
    final InMemoryKeyValueStore store = new InMemoryKeyValueStore();
    store.set("api_cache:expenses", "1");
    store.set("api_cache:categories", "2");
    store.set("finly_access_token", "3");

    assertThat(store.keys("api_cache:"))
        .containsExactlyInAnyOrder("api_cache:expenses", "api_cache:categories");

    store.deleteMany(List.of("api_cache:expenses", "missing"));

    assertThat(store.keys("")).containsExactlyInAnyOrder("api_cache:categories", "finly_access_token");
  }

  @Test
  void rejectsBlankKey() {
    final InMemoryKeyValueStore store = new InMemoryKeyValueStore();

    assertThatThrownBy(() -> store.set(" ", "value"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessage("key is required");
  }
}
