package com.shading.sgc.model;

import com.shading.sgc.api.ExpressionRule;
import com.shading.sgc.api.KindResolver;
import com.shading.sgc.api.Literal;
import com.shading.sgc.api.ValueKind;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * Registry mapping {@link NodeKind}s to their pin layouts and expression rules.
 */
public final class NodeRegistry {

    private static final NodeRegistry BUILT_INS = new NodeRegistry();

    private static final String FRESNEL_TERM = "pow(1.0 - max(dot(normalize(Normal), normalize(viewPos - FragPos)), 0.0), ";

    private final Map<NodeKind, NodeDescriptor> registry = new EnumMap<>(NodeKind.class);

    private NodeRegistry() {
        registerBuiltIns();
    }

    /** The registry holding every built-in node kind. */
    public static NodeRegistry builtIns() {
        return BUILT_INS;
    }

    /**
     * @throws IllegalArgumentException if the kind has no descriptor.
     */
    public NodeDescriptor descriptor(NodeKind kind) {
        NodeDescriptor d = registry.get(kind);
        if (d == null)
            throw new IllegalArgumentException("No descriptor for node kind " + kind);
        return d;
    }

    private void register(NodeKind kind, List<InputPin> inputs, List<OutputPin> outputs,
            Map<String, PropertyType> types, Map<String, Object> defaults) {
        registry.put(kind, new NodeDescriptor(kind, inputs, outputs, types, defaults));
    }

    // ── Built-in descriptors ────────────────────────────────────────

    private void registerBuiltIns() {
        // --- Inputs (no input pins) ---
        registerSource(NodeKind.TIME, fixed("Time", ValueKind.SCALAR, ctx -> "time"));
        registerSource(NodeKind.POSITION,
                fixed("XYZ", ValueKind.VECTOR3, ctx -> "FragPos"),
                fixed("X", ValueKind.SCALAR, ctx -> "FragPos.x"),
                fixed("Y", ValueKind.SCALAR, ctx -> "FragPos.y"),
                fixed("Z", ValueKind.SCALAR, ctx -> "FragPos.z"));
        registerSource(NodeKind.NORMAL, fixed("Normal", ValueKind.VECTOR3, ctx -> "normalize(Normal)"));
        register(NodeKind.FRESNEL,
                List.of(InputPin.scalar("Power", 2.0)),
                List.of(fixed("Factor", ValueKind.SCALAR, ctx -> FRESNEL_TERM + ctx.input("Power") + ")")),
                Map.of(), Map.of());

        // --- Constants ---
        register(NodeKind.FLOAT, List.of(),
                List.of(fixed("Value", ValueKind.SCALAR,
                        ctx -> ctx.literal(Literal.scalar(NodeProperties.getDouble(ctx.properties(), "value", 0.0))))),
                Map.of("value", PropertyType.NUMBER), Map.of("value", 0.0));
        register(NodeKind.COLOR, List.of(),
                List.of(fixed("RGB", ValueKind.VECTOR3,
                        ctx -> ctx.literal(Literal.of(NodeProperties.getDoubles(ctx.properties(), "color",
                                List.of(1.0, 0.5, 0.2)))))),
                Map.of("color", PropertyType.COLOR), Map.of("color", List.of(1.0, 0.5, 0.2)));

        // --- Binary math (2 scalar inputs) ---
        registerBinary(NodeKind.ADD, 0.0, "+");
        registerBinary(NodeKind.SUBTRACT, 0.0, "-");
        registerBinary(NodeKind.DIVIDE, 1.0, "/");

        // Multiply accepts any kind on both inputs, so it can scale vectors.
        register(NodeKind.MULTIPLY,
                List.of(InputPin.anyKind("A", 1.0), InputPin.anyKind("B", 1.0)),
                List.of(new OutputPin("Result", KindResolver.WIDEST_INPUT,
                        ctx -> "(" + ctx.input("A") + " * " + ctx.input("B") + ")", true)),
                Map.of(), Map.of());

        // --- Unary math ---
        registerUnary(NodeKind.SIN, x -> "sin(" + x + ")");
        registerUnary(NodeKind.COS, x -> "cos(" + x + ")");
        registerUnary(NodeKind.ABS, x -> "abs(" + x + ")");

        register(NodeKind.MIX,
                List.of(InputPin.scalar("A", 0.0), InputPin.scalar("B", 1.0), InputPin.scalar("T", 0.5)),
                List.of(fixed("Result", ValueKind.SCALAR,
                        ctx -> ctx.interpolate(ctx.input("A"), ctx.input("B"), ctx.input("T")))),
                Map.of(), Map.of());

        // Clamp bounds are node configuration, not pins.
        register(NodeKind.CLAMP,
                List.of(InputPin.scalar("X", 0.0)),
                List.of(fixed("Result", ValueKind.SCALAR, ctx -> "clamp(" + ctx.input("X") + ", "
                        + ctx.literal(Literal.scalar(NodeProperties.getDouble(ctx.properties(), "min", 0.0))) + ", "
                        + ctx.literal(Literal.scalar(NodeProperties.getDouble(ctx.properties(), "max", 1.0))) + ")")),
                Map.of("min", PropertyType.NUMBER, "max", PropertyType.NUMBER),
                Map.of("min", 0.0, "max", 1.0));

        // --- Vector ---
        register(NodeKind.MAKE_VEC3,
                List.of(InputPin.scalar("X", 0.0), InputPin.scalar("Y", 0.0), InputPin.scalar("Z", 0.0)),
                List.of(fixed("Vec3", ValueKind.VECTOR3,
                        ctx -> ctx.construct(ValueKind.VECTOR3, ctx.input("X"), ctx.input("Y"), ctx.input("Z")))),
                Map.of(), Map.of());
        register(NodeKind.SPLIT_VEC3,
                List.of(InputPin.vector3("Vec3", 0.0, 0.0, 0.0)),
                List.of(component("X", "x"), component("Y", "y"), component("Z", "z")),
                Map.of(), Map.of());

        // --- Parameters: the expression is the uniform's name ---
        register(NodeKind.SCALAR_PARAMETER, List.of(),
                List.of(fixed("Value", ValueKind.SCALAR, ctx -> NodeProperties.getString(ctx.properties(), "name", ""))),
                Map.of("name", PropertyType.IDENTIFIER, "label", PropertyType.TEXT, "value", PropertyType.NUMBER),
                Map.of("value", 0.0));
        register(NodeKind.VECTOR_PARAMETER, List.of(),
                List.of(new OutputPin("Value",
                        probe -> ValueKind.ofComponents(
                                NodeProperties.getDoubles(probe.properties(), "value", List.of(0.0, 0.0, 0.0)).size()),
                        ctx -> NodeProperties.getString(ctx.properties(), "name", ""), false)),
                Map.of("name", PropertyType.IDENTIFIER, "label", PropertyType.TEXT, "value", PropertyType.VECTOR),
                Map.of("value", List.of(0.0, 0.0, 0.0)));

        // --- Sink ---
        register(NodeKind.OUTPUT,
                List.of(InputPin.vector3("Color", 1.0, 0.5, 0.2), InputPin.scalar("Alpha", 1.0)),
                List.of(), Map.of(), Map.of());
    }

    // ── Helper methods to eliminate registration boilerplate ──────────

    private void registerSource(NodeKind kind, OutputPin... outputs) {
        register(kind, List.of(), List.of(outputs), Map.of(), Map.of());
    }

    private void registerBinary(NodeKind kind, double defaultValue, String operator) {
        register(kind,
                List.of(InputPin.scalar("A", defaultValue), InputPin.scalar("B", defaultValue)),
                List.of(fixed("Result", ValueKind.SCALAR,
                        ctx -> "(" + ctx.input("A") + " " + operator + " " + ctx.input("B") + ")")),
                Map.of(), Map.of());
    }

    private void registerUnary(NodeKind kind, UnaryOperator<String> wrap) {
        register(kind,
                List.of(InputPin.scalar("X", 0.0)),
                List.of(fixed("Result", ValueKind.SCALAR, ctx -> wrap.apply(ctx.input("X")))),
                Map.of(), Map.of());
    }

    private static OutputPin fixed(String name, ValueKind kind, ExpressionRule rule) {
        return new OutputPin(name, KindResolver.fixed(kind), rule, false);
    }

    private static OutputPin component(String name, String member) {
        return fixed(name, ValueKind.SCALAR, ctx -> "(" + ctx.input("Vec3") + ")." + member);
    }
}
