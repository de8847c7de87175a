package com.partner.match.models;

public class FibNode<T> {
    final T data;
    FibNode<T> parent, child, left, right;
    int degree;
    boolean mark;

    public FibNode(T data) {
        this.data = data;
        this.degree = 0;
        this.mark = false;
        this.left = this.right = this;
    }
}
