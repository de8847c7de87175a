package com.partner.match.models;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

/**
 * Min-oriented Fibonacci heap ordered by a comparator.
 * Insert is O(1); extractMin is amortised O(log n).
 */
public class FibonacciHeap<T> {
    private final Comparator<? super T> comparator;
    private FibNode<T> min;
    private int size;

    public FibonacciHeap(Comparator<? super T> comparator) {
        this.comparator = Objects.requireNonNull(comparator, "comparator");
    }

    public void insert(T data) {
        FibNode<T> node = new FibNode<>(data);
        min = meld(min, node);
        size++;
    }

    public boolean isEmpty() {
        return min == null;
    }

    public int size() {
        return size;
    }

    public T peekMin() {
        return min != null ? min.data : null;
    }

    public T extractMin() {
        FibNode<T> oldMin = min;
        if (oldMin == null) {
            return null;
        }

        if (oldMin.child != null) {
            for (FibNode<T> child : siblings(oldMin.child)) {
                child.parent = null;
                child.left = child.right = child;
                spliceRight(oldMin, child);
            }
            oldMin.child = null;
        }

        if (oldMin.right == oldMin) {
            min = null;
        } else {
            min = oldMin.right;
            removeFromList(oldMin);
            consolidate();
        }
        size--;
        return oldMin.data;
    }

    private void consolidate() {
        List<FibNode<T>> byDegree = new ArrayList<>();
        for (FibNode<T> root : siblings(min)) {
            FibNode<T> x = root;
            int degree = x.degree;
            while (degree < byDegree.size() && byDegree.get(degree) != null) {
                FibNode<T> y = byDegree.get(degree);
                if (less(y, x)) {
                    FibNode<T> swap = x;
                    x = y;
                    y = swap;
                }
                link(y, x);
                byDegree.set(degree, null);
                degree++;
            }
            while (byDegree.size() <= degree) {
                byDegree.add(null);
            }
            byDegree.set(degree, x);
        }

        min = null;
        for (FibNode<T> node : byDegree) {
            if (node != null) {
                node.left = node.right = node;
                min = meld(min, node);
            }
        }
    }

    private void link(FibNode<T> child, FibNode<T> parent) {
        child.left = child.right = child;
        child.parent = parent;
        child.mark = false;
        if (parent.child == null) {
            parent.child = child;
        } else {
            spliceRight(parent.child, child);
        }
        parent.degree++;
    }

    private List<FibNode<T>> siblings(FibNode<T> start) {
        List<FibNode<T>> nodes = new ArrayList<>();
        FibNode<T> x = start;
        do {
            nodes.add(x);
            x = x.right;
        } while (x != start);
        return nodes;
    }

    private void spliceRight(FibNode<T> anchor, FibNode<T> node) {
        node.right = anchor.right;
        node.left = anchor;
        anchor.right.left = node;
        anchor.right = node;
    }

    private void removeFromList(FibNode<T> node) {
        node.left.right = node.right;
        node.right.left = node.left;
        node.left = node.right = node;
    }

    private FibNode<T> meld(FibNode<T> a, FibNode<T> b) {
        if (a == null) return b;
        if (b == null) return a;

        FibNode<T> aRight = a.right;
        a.right = b.right;
        a.right.left = a;
        b.right = aRight;
        b.right.left = b;

        return less(b, a) ? b : a;
    }

    private boolean less(FibNode<T> a, FibNode<T> b) {
        return comparator.compare(a.data, b.data) < 0;
    }
}
