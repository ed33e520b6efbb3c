package com.healthtech.olap.data.star;

import java.util.Collection;
import java.util.Optional;
import java.util.Set;

import com.google.common.collect.ImmutableBiMap;
import com.google.common.collect.ImmutableSortedSet;

/**
 * Maps natural (business) keys of one dimension to the surrogate keys stored in the star schema.
 *
 * Keys are handed out 1..n in ascending natural-key order, so two runs over the same source assign the same surrogate key to the same
 * natural key. The mapping is a bimap: one surrogate key never stands for two natural keys.
 *
 * @param <K> the natural key type
 */
public class SurrogateKeyResolver<K extends Comparable<? super K>> {

    private final ImmutableBiMap<K, Integer> keys;

    private SurrogateKeyResolver(ImmutableBiMap<K, Integer> keys) {
        this.keys = keys;
    }

    /**
     * Assigns surrogate keys to the distinct values of {@code naturalKeys}. Duplicates collapse to one key; nulls are rejected.
     */
    public static <K extends Comparable<? super K>> SurrogateKeyResolver<K> assign(Collection<K> naturalKeys) {
        ImmutableBiMap.Builder<K, Integer> builder = ImmutableBiMap.builder();
        int next = 1;
        for (K naturalKey : ImmutableSortedSet.copyOf(naturalKeys)) {
            builder.put(naturalKey, next++);
        }
        return new SurrogateKeyResolver<>(builder.build());
    }

    public Optional<Integer> keyFor(K naturalKey) {
        if (naturalKey == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(keys.get(naturalKey));
    }

    public Optional<K> naturalKeyFor(int surrogateKey) {
        return Optional.ofNullable(keys.inverse().get(surrogateKey));
    }

    public Set<K> naturalKeys() {
        return keys.keySet();
    }

    public int size() {
        return keys.size();
    }
}
