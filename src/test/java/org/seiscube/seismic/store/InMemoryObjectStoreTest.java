package org.seiscube.seismic.store;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryObjectStoreTest {

    @Test
    void storesCopiesAndListsByPrefix() {
        InMemoryObjectStore store = new InMemoryObjectStore();
        byte[] payload = {1, 2, 3};

        store.put("cubes/a/metadata.json", payload, ObjectStore.CONTENT_TYPE_JSON);
        store.put("cubes/a/slices/inline_1.npy", new byte[]{9}, ObjectStore.CONTENT_TYPE_BINARY);
        store.put("cubes/b/metadata.json", new byte[]{7}, ObjectStore.CONTENT_TYPE_JSON);
        payload[0] = 42;

        assertThat(store.get("cubes/a/metadata.json")).hasValueSatisfying(b -> assertThat(b).containsExactly(1, 2, 3));
        assertThat(store.contentType("cubes/a/slices/inline_1.npy")).isEqualTo(ObjectStore.CONTENT_TYPE_BINARY);
        assertThat(store.list("cubes/a/")).containsExactly("cubes/a/metadata.json", "cubes/a/slices/inline_1.npy");
        assertThat(store.deletePrefix("cubes/a/")).hasSize(2);
        assertThat(store.list("")).containsExactly("cubes/b/metadata.json");
        assertThat(store.exists("cubes/a/metadata.json")).isFalse();
    }

    @Test
    void unavailableStoreIsFailingNoOp() {
        UnavailableObjectStore store = new UnavailableObjectStore();

        assertThat(store.isAvailable()).isFalse();
        assertThat(store.kind()).isEqualTo("none");
        assertThat(store.put("k", new byte[]{1}, ObjectStore.CONTENT_TYPE_BINARY)).isFalse();
        assertThat(store.get("k")).isEmpty();
        assertThat(store.list("")).isEmpty();
        assertThat(store.deletePrefix("")).isEmpty();
        assertThat(store.exists("k")).isFalse();
    }
}
