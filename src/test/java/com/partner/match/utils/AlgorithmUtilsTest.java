package com.partner.match.utils;

import org.junit.jupiter.api.Test;

import java.util.Comparator;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class AlgorithmUtilsTest {

    private record Item(String name, double score) {
    }

    @Test
    void shouldSortStably() {
        List<Item> items = List.of(new Item("a", 1), new Item("b", 2), new Item("c", 1), new Item("d", 2), new Item("e", 0));

        List<Item> sorted = AlgorithmUtils.stableSort(items, Comparator.comparingDouble(Item::score).reversed());

        assertEquals(List.of("b", "d", "a", "c", "e"), sorted.stream().map(Item::name).toList());
    }

    @Test
    void shouldAcceptNonTransitiveComparator() {
        Comparator<Double> tolerant = (x, y) -> Math.abs(x - y) <= 0.1 ? 0 : Double.compare(y, x);
        List<Double> values = List.of(0.5, 0.55, 0.6, 0.65, 0.7, 0.2, 0.9, 0.58, 0.61, 0.3,
                0.52, 0.57, 0.63, 0.66, 0.59, 0.51, 0.68, 0.62, 0.54, 0.56, 0.64, 0.67, 0.69, 0.53, 0.1, 0.95, 0.85, 0.75, 0.45, 0.35, 0.25, 0.15);

        List<Double> sorted = AlgorithmUtils.stableSort(values, tolerant);

        assertEquals(values.size(), sorted.size());
        assertTrue(sorted.containsAll(values));
    }

    @Test
    void shouldReturnTopKInDescendingOrderKeepingInputOrderOnTies() {
        List<Item> items = List.of(new Item("a", 0.5), new Item("b", 0.9), new Item("c", 0.5), new Item("d", 0.1), new Item("e", 0.9));

        List<Item> top = AlgorithmUtils.topK(items, Item::score, 3);

        assertEquals(List.of("b", "e", "a"), top.stream().map(Item::name).toList());
    }

    @Test
    void shouldHandleDegenerateTopK() {
        List<Item> items = List.of(new Item("a", 1));

        assertEquals(List.of(), AlgorithmUtils.topK(items, Item::score, 0));
        assertEquals(List.of(), AlgorithmUtils.topK(List.<Item>of(), Item::score, 5));
        assertEquals(1, AlgorithmUtils.topK(items, Item::score, 5).size());
    }
}
