package com.healthtech.olap.data.star;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.TreeMap;
import java.util.function.BiFunction;
import java.util.function.Function;

import com.google.common.collect.ImmutableList;

/**
 * One loaded dimension: its rows, in surrogate key order, plus the resolver that fact and bridge loads use to look keys up.
 *
 * @param <K> natural key type
 * @param <R> row type
 */
public class DimensionTable<K extends Comparable<? super K>, R> {

    private final String tableName;
    private final SurrogateKeyResolver<K> keys;
    private final ImmutableList<R> rows;

    private DimensionTable(String tableName, SurrogateKeyResolver<K> keys, ImmutableList<R> rows) {
        this.tableName = tableName;
        this.keys = keys;
        this.rows = rows;
    }

    /**
     * Builds a dimension with one row per distinct natural key. When two source rows share a natural key the first one wins.
     *
     * @param tableName  target table, for logging and run tracking
     * @param source     source rows, already filtered of anything the dimension excludes
     * @param naturalKey extracts the natural key; rows whose key is null are skipped
     * @param toRow      builds the dimension row from its surrogate key and source row
     */
    public static <S, K extends Comparable<? super K>, R> DimensionTable<K, R> build(
        String tableName, Collection<S> source, Function<S, K> naturalKey, BiFunction<Integer, S, R> toRow
    ) {
        TreeMap<K, S> byNaturalKey = new TreeMap<>();
        for (S row : source) {
            K key = naturalKey.apply(row);
            if (key != null) {
                byNaturalKey.putIfAbsent(key, row);
            }
        }
        SurrogateKeyResolver<K> keys = SurrogateKeyResolver.assign(byNaturalKey.keySet());
        ImmutableList.Builder<R> rows = ImmutableList.builderWithExpectedSize(byNaturalKey.size());
        byNaturalKey.forEach((key, row) -> rows.add(toRow.apply(keys.keyFor(key).orElseThrow(), row)));
        return new DimensionTable<>(tableName, keys, rows.build());
    }

    public String getTableName() {
        return tableName;
    }

    public List<R> getRows() {
        return rows;
    }

    public Optional<Integer> keyFor(K naturalKey) {
        return keys.keyFor(naturalKey);
    }

    public int size() {
        return rows.size();
    }
}
