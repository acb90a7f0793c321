package org.pcc.compiler.util;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains unit tests for the {@link ChainedHashMap}.
 */
public class ChainedHashMapTest {

    /** A key whose instances all land in the same bucket. */
    private record CollidingKey(String id) {
        @Override
        public int hashCode() {
            return 7;
        }
    }

    @Test
    @Tag("unit")
    void testDjb2() {
        assertThat(ChainedHashMap.djb2("")).isEqualTo(5381L);
        assertThat(ChainedHashMap.djb2("a")).isEqualTo(5381L * 33 + 97);
        assertThat(ChainedHashMap.djb2("ab")).isEqualTo((5381L * 33 + 97) * 33 + 98);
        // Wraps at 32 bits and stays non-negative.
        assertThat(ChainedHashMap.djb2("a fairly long identifier name")).isBetween(0L, 0xFFFFFFFFL);
    }

    /**
     * Verifies that the table doubles when the thirteenth entry exceeds the 0.75 load factor.
     */
    @Test
    @Tag("unit")
    void testResizeKeepsAllEntries() {
        // Arrange
        ChainedHashMap<String, Integer> map = new ChainedHashMap<>();
        for (int i = 0; i < 12; i++) {
            map.put("key" + i, i);
        }
        assertThat(map.capacity()).isEqualTo(16);

        // Act
        map.put("key12", 12);

        // Assert
        assertThat(map.capacity()).isEqualTo(32);
        assertThat(map.size()).isEqualTo(13);
        for (int i = 0; i <= 12; i++) {
            assertThat(map.get("key" + i)).isEqualTo(i);
        }
        assertThat(map.keys()).hasSize(13);
    }

    /**
     * Verifies put, replace and remove within one collision chain.
     */
    @Test
    @Tag("unit")
    void testCollisionChain() {
        // Arrange
        ChainedHashMap<CollidingKey, String> map = new ChainedHashMap<>();
        CollidingKey a = new CollidingKey("a");
        CollidingKey b = new CollidingKey("b");
        CollidingKey c = new CollidingKey("c");
        map.put(a, "1");
        map.put(b, "2");
        map.put(c, "3");

        // Act
        String replaced = map.put(b, "two");
        String removedMiddle = map.remove(b);
        String removedMissing = map.remove(new CollidingKey("zzz"));

        // Assert
        assertThat(replaced).isEqualTo("2");
        assertThat(removedMiddle).isEqualTo("two");
        assertThat(removedMissing).isNull();
        assertThat(map.size()).isEqualTo(2);
        assertThat(map.get(a)).isEqualTo("1");
        assertThat(map.get(c)).isEqualTo("3");
        assertThat(map.containsKey(b)).isFalse();
    }

    /**
     * Verifies behaviour against {@link HashMap} over a mixed sequence of operations.
     */
    @Test
    @Tag("unit")
    void testMatchesJdkMap() {
        // Arrange
        ChainedHashMap<String, Integer> map = new ChainedHashMap<>(2);
        Map<String, Integer> expected = new HashMap<>();

        // Act
        for (int i = 0; i < 200; i++) {
            String key = "k" + (i * 7 % 53);
            if (i % 5 == 0) {
                assertThat(map.remove(key)).isEqualTo(expected.remove(key));
            } else {
                assertThat(map.put(key, i)).isEqualTo(expected.put(key, i));
            }
        }

        // Assert
        assertThat(map.size()).isEqualTo(expected.size());
        Map<String, Integer> copied = new HashMap<>();
        map.forEach(copied::put);
        assertThat(copied).isEqualTo(expected);
    }

    @Test
    @Tag("unit")
    void testNullKeysAndClear() {
        ChainedHashMap<String, String> map = new ChainedHashMap<>();
        assertThatThrownBy(() -> map.put(null, "x")).isInstanceOf(NullPointerException.class);
        assertThatThrownBy(() -> new ChainedHashMap<String, String>(0)).isInstanceOf(IllegalArgumentException.class);

        map.put("present", null);
        assertThat(map.containsKey("present")).isTrue();
        assertThat(map.get("present")).isNull();

        map.clear();
        assertThat(map.isEmpty()).isTrue();
        assertThat(map.capacity()).isEqualTo(16);
    }
}
