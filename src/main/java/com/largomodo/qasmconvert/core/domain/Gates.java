package com.largomodo.qasmconvert.core.domain;

import java.util.List;

/**
 * Factory for the primitive gate vocabulary.
 * <p>
 * Names are the canonical spelling; the exporter lower-cases them and prefixes one
 * {@code c} per control, so {@code X} with one control serializes as {@code cx}.
 */
public final class Gates {

    public static final String X = "X";
    public static final String Y = "Y";
    public static final String Z = "Z";
    public static final String H = "H";
    public static final String S = "S";
    public static final String T = "T";
    public static final String TDG = "Tdg";
    public static final String RX = "Rx";
    public static final String RY = "Ry";
    public static final String RZ = "Rz";
    public static final String PHASE = "Phase";
    public static final String SWAP = "SWAP";

    private Gates() {
        // Static factory - prevent instantiation
    }

    public static Gate x(int target) {
        return new Gate(X, List.of(target));
    }

    public static Gate x(List<Integer> targets, List<Integer> controls) {
        return new Gate(X, targets, controls, null);
    }

    public static Gate y(int target) {
        return new Gate(Y, List.of(target));
    }

    public static Gate y(List<Integer> targets, List<Integer> controls) {
        return new Gate(Y, targets, controls, null);
    }

    public static Gate z(int target) {
        return new Gate(Z, List.of(target));
    }

    public static Gate z(List<Integer> targets, List<Integer> controls) {
        return new Gate(Z, targets, controls, null);
    }

    public static Gate h(int target) {
        return new Gate(H, List.of(target));
    }

    public static Gate h(List<Integer> targets, List<Integer> controls) {
        return new Gate(H, targets, controls, null);
    }

    public static Gate s(int target) {
        return new Gate(S, List.of(target));
    }

    public static Gate t(int target) {
        return new Gate(T, List.of(target));
    }

    public static Gate tdg(int target) {
        return new Gate(TDG, List.of(target));
    }

    public static Gate cnot(int control, int target) {
        return new Gate(X, List.of(target), List.of(control), null);
    }

    public static Gate toffoli(int firstControl, int secondControl, int target) {
        return new Gate(X, List.of(target), List.of(firstControl, secondControl), null);
    }

    public static Gate rx(Parameter angle, int target) {
        return new Gate(RX, List.of(target), List.of(), angle);
    }

    public static Gate rx(Parameter angle, List<Integer> targets, List<Integer> controls) {
        return new Gate(RX, targets, controls, angle);
    }

    public static Gate ry(Parameter angle, int target) {
        return new Gate(RY, List.of(target), List.of(), angle);
    }

    public static Gate ry(Parameter angle, List<Integer> targets, List<Integer> controls) {
        return new Gate(RY, targets, controls, angle);
    }

    public static Gate rz(Parameter angle, int target) {
        return new Gate(RZ, List.of(target), List.of(), angle);
    }

    public static Gate rz(Parameter angle, List<Integer> targets, List<Integer> controls) {
        return new Gate(RZ, targets, controls, angle);
    }

    public static Gate phase(Parameter phi, int target) {
        return new Gate(PHASE, List.of(target), List.of(), phi);
    }

    public static Gate phase(Parameter phi, List<Integer> targets, List<Integer> controls) {
        return new Gate(PHASE, targets, controls, phi);
    }

    public static Gate swap(int first, int second) {
        return new Gate(SWAP, List.of(first, second));
    }

    public static Gate swap(int first, int second, List<Integer> controls) {
        return new Gate(SWAP, List.of(first, second), controls, null);
    }
}
