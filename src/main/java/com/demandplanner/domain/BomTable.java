package com.demandplanner.domain;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.ArrayList;
import java.util.Collections;

public final class BomTable {

    private final Map<Key, List<BomLine>> lines;
    private final Set<String> products;

    private BomTable(Map<Key, List<BomLine>> lines, Set<String> products) {
        this.lines = lines;
        this.products = products;
    }

    public static BomTable of(Collection<BomLine> bomLines) {
        Map<Key, List<BomLine>> index = new LinkedHashMap<>();
        Set<String> products = new LinkedHashSet<>();
        for (BomLine line : bomLines) {
            index.computeIfAbsent(new Key(line.variationKey(), line.size()), k -> new ArrayList<>()).add(line);
            if (line.productName() != null) {
                products.add(line.productName());
            }
        }
        index.replaceAll((k, v) -> List.copyOf(v));
        return new BomTable(Collections.unmodifiableMap(index), Collections.unmodifiableSet(products));
    }

    public List<BomLine> linesFor(String variationKey, String size) {
        return lines.getOrDefault(new Key(variationKey, size), List.of());
    }

    public boolean hasProduct(String productName) {
        return products.contains(productName);
    }

    public Set<String> products() {
        return products;
    }

    public int size() {
        return lines.values().stream().mapToInt(List::size).sum();
    }

    private record Key(String variationKey, String size) {}
}
