package com.largomodo.qasmconvert.service;

import com.largomodo.qasmconvert.core.domain.Circuit;
import com.largomodo.qasmconvert.core.domain.Gate;
import com.largomodo.qasmconvert.core.domain.Gates;
import com.largomodo.qasmconvert.core.domain.Parameter;
import com.largomodo.qasmconvert.core.domain.VariableAssignment;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrite-rule implementation of {@link BasisCompiler} for the {@link Gates} vocabulary.
 * <p>
 * <b>Rewrites</b> (first matching rule wins, repeated until no rule applies):
 * <ul>
 *   <li>{@code multitarget}: one gate per target, same controls and parameter (SWAP excluded)</li>
 *   <li>{@code swap}: three CNOTs; controls go on the middle one (Fredkin form)</li>
 *   <li>{@code yGate}: Y as Z then X, or Rz(-pi/2) . controlled X . Rz(pi/2) when controlled</li>
 *   <li>{@code ryGate}: Ry(t) as Rz(-pi/2) . Rx(t) . Rz(pi/2), controls on the Rx</li>
 *   <li>{@code phaseToZ}: Phase(pi) with a constant angle becomes Z</li>
 *   <li>{@code controlledPhase}: singly-controlled Phase via Rz and two CNOTs</li>
 *   <li>{@code phase}: uncontrolled Phase as Rz (equal up to global phase)</li>
 *   <li>{@code controlledRotation}: singly-controlled Rz/Ry via half angles and two CNOTs,
 *       Rx by conjugating with H</li>
 *   <li>{@code toffoli}: doubly-controlled X as the 6-CNOT H/T network</li>
 * </ul>
 * The remaining flags name gate families this vocabulary does not have and are no-ops.
 * {@code ccMax} does not reduce control arity: gates with more than two controls pass
 * through and are rejected by the exporter.
 * <p>
 * Stateless. Safe for concurrent use.
 */
public class DefaultBasisCompiler implements BasisCompiler {

    private static final Logger log = LoggerFactory.getLogger(DefaultBasisCompiler.class);

    // Every rule strictly shrinks the gate family it rewrites; this only guards against a broken rule
    private static final int MAX_PASSES = 32;

    private static final Parameter HALF_PI = Parameter.constant(Math.PI / 2);
    private static final Parameter MINUS_HALF_PI = Parameter.constant(-Math.PI / 2);
    private static final double PI_TOLERANCE = 1e-12;

    @Override
    public Circuit compile(Circuit circuit, CompilerOptions options) {
        List<Gate> current = circuit.gates();

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            List<Gate> next = new ArrayList<>(current.size());
            boolean changed = false;

            for (Gate gate : current) {
                List<Gate> rewritten = rewrite(gate, options);
                if (rewritten == null) {
                    next.add(gate);
                } else {
                    next.addAll(rewritten);
                    changed = true;
                }
            }

            if (!changed) {
                log.debug("Compiled {} gates into {} gates in {} passes", circuit.size(), current.size(), pass);
                return new Circuit(current, circuit.declaredWidth());
            }
            current = next;
        }

        throw new IllegalStateException("Basis compilation did not converge after " + MAX_PASSES + " passes");
    }

    /**
     * @return replacement gates, or {@code null} if no rule applies
     */
    private List<Gate> rewrite(Gate gate, CompilerOptions options) {
        if (options.multitarget() && gate.targets().size() > 1 && !gate.is(Gates.SWAP)) {
            return splitTargets(gate);
        }
        if (options.swap() && gate.is(Gates.SWAP)) {
            return expandSwap(gate);
        }
        if (gate.targets().size() != 1) {
            return null;
        }
        if (options.yGate() && gate.is(Gates.Y)) {
            return expandY(gate);
        }
        if (options.ryGate() && gate.is(Gates.RY) && gate.hasParameter()) {
            return expandRy(gate);
        }
        if (options.phaseToZ() && gate.is(Gates.PHASE) && isConstantPi(gate.parameter())) {
            return List.of(new Gate(Gates.Z, gate.targets(), gate.controls(), null));
        }
        if (options.controlledPhase() && gate.is(Gates.PHASE) && gate.hasParameter()
                && gate.controls().size() == 1) {
            return expandControlledPhase(gate);
        }
        if (options.phase() && gate.is(Gates.PHASE) && gate.hasParameter() && !gate.isControlled()) {
            return List.of(new Gate(Gates.RZ, gate.targets(), List.of(), gate.parameter()));
        }
        if (options.controlledRotation() && gate.controls().size() == 1 && isRotation(gate)) {
            return expandControlledRotation(gate);
        }
        if (options.toffoli() && gate.is(Gates.X) && gate.controls().size() == 2) {
            return expandToffoli(gate);
        }
        return null;
    }

    private static List<Gate> splitTargets(Gate gate) {
        List<Gate> gates = new ArrayList<>(gate.targets().size());
        for (Integer target : gate.targets()) {
            gates.add(gate.withTargets(List.of(target)));
        }
        return gates;
    }

    private static List<Gate> expandSwap(Gate gate) {
        if (gate.targets().size() != 2) {
            throw new IllegalArgumentException("SWAP needs exactly two targets: " + gate);
        }
        int a = gate.targets().get(0);
        int b = gate.targets().get(1);

        List<Integer> middleControls = new ArrayList<>(gate.controls());
        middleControls.add(a);

        return List.of(
                Gates.cnot(b, a),
                Gates.x(List.of(b), middleControls),
                Gates.cnot(b, a)
        );
    }

    private static List<Gate> expandY(Gate gate) {
        int target = singleTarget(gate);
        if (!gate.isControlled()) {
            // XZ = -iY: global phase only
            return List.of(Gates.z(target), Gates.x(target));
        }
        // Rz(pi/2) X Rz(-pi/2) = Y exactly, so the conjugation survives the controls
        return List.of(
                Gates.rz(MINUS_HALF_PI, target),
                Gates.x(List.of(target), gate.controls()),
                Gates.rz(HALF_PI, target)
        );
    }

    private static List<Gate> expandRy(Gate gate) {
        int target = singleTarget(gate);
        return List.of(
                Gates.rz(MINUS_HALF_PI, target),
                Gates.rx(gate.parameter(), List.of(target), gate.controls()),
                Gates.rz(HALF_PI, target)
        );
    }

    private static List<Gate> expandControlledPhase(Gate gate) {
        int control = gate.controls().get(0);
        int target = singleTarget(gate);
        Parameter half = gate.parameter().scale(0.5);

        return List.of(
                Gates.rz(half, control),
                Gates.cnot(control, target),
                Gates.rz(half.negate(), target),
                Gates.cnot(control, target),
                Gates.rz(half, target)
        );
    }

    private static List<Gate> expandControlledRotation(Gate gate) {
        int control = gate.controls().get(0);
        int target = singleTarget(gate);

        if (gate.is(Gates.RX)) {
            return List.of(
                    Gates.h(target),
                    Gates.rz(gate.parameter(), List.of(target), List.of(control)),
                    Gates.h(target)
            );
        }

        // X R(a) X = R(-a) for Rz and Ry
        Parameter half = gate.parameter().scale(0.5);
        return List.of(
                new Gate(gate.name(), List.of(target), List.of(), half),
                Gates.cnot(control, target),
                new Gate(gate.name(), List.of(target), List.of(), half.negate()),
                Gates.cnot(control, target)
        );
    }

    private static List<Gate> expandToffoli(Gate gate) {
        int a = gate.controls().get(0);
        int b = gate.controls().get(1);
        int c = singleTarget(gate);

        return List.of(
                Gates.h(c),
                Gates.cnot(b, c),
                Gates.tdg(c),
                Gates.cnot(a, c),
                Gates.t(c),
                Gates.cnot(b, c),
                Gates.tdg(c),
                Gates.cnot(a, c),
                Gates.t(b),
                Gates.t(c),
                Gates.h(c),
                Gates.cnot(a, b),
                Gates.t(a),
                Gates.tdg(b),
                Gates.cnot(a, b)
        );
    }

    private static boolean isRotation(Gate gate) {
        return gate.hasParameter() && (gate.is(Gates.RX) || gate.is(Gates.RY) || gate.is(Gates.RZ));
    }

    private static boolean isConstantPi(Parameter parameter) {
        return parameter != null
                && parameter.isConstant()
                && Math.abs(parameter.evaluate(VariableAssignment.empty()) - Math.PI) < PI_TOLERANCE;
    }

    private static int singleTarget(Gate gate) {
        if (gate.targets().size() != 1) {
            throw new IllegalArgumentException("Expected a single-target gate, got: " + gate);
        }
        return gate.targets().get(0);
    }
}
