package com.nilsson.promptsyntax.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 <h2>SwapOptions</h2>
 <p>
 Immutable option bag attached to a {@link CrossAttentionControlSubstitute}. The four schedule
 keys are always present; values given by the prompt override the defaults.
 </p>

 <h3>Recognized keys:</h3>
 <ul>
 <li>{@code s_start}, {@code s_end}: spatial attention window, defaults {@code 0.0} and {@value #DEFAULT_S_END}.</li>
 <li>{@code t_start}, {@code t_end}: token attention window, defaults {@code 0.0} and {@code 1.0}.</li>
 <li>{@code shape_freedom}: in {@code [0,1]}, converted once to {@code s_end = 1 - shape_freedom^(1/3)}
 and then dropped from the map. An explicit {@code s_end} still wins.</li>
 </ul>
 <p>
 Any other key is kept verbatim.
 </p>
 */
public final class SwapOptions {

    public static final String S_START = "s_start";
    public static final String S_END = "s_end";
    public static final String T_START = "t_start";
    public static final String T_END = "t_end";
    public static final String SHAPE_FREEDOM = "shape_freedom";
    public static final String WEIGHT = "weight";

    /** {@code s_end} that corresponds to {@code shape_freedom=0.5}. */
    public static final double DEFAULT_S_END = 0.2062994740159002;

    private static final Set<String> NUMERIC_KEYS = Set.of(S_START, S_END, T_START, T_END, SHAPE_FREEDOM, WEIGHT);

    private static final SwapOptions DEFAULTS = new SwapOptions(defaultValues());

    private final Map<String, OptionValue> values;

    private SwapOptions(Map<String, OptionValue> values) {
        this.values = Collections.unmodifiableMap(values);
    }

    // ------------------------------------------------------------------------
    // Factories
    // ------------------------------------------------------------------------

    public static SwapOptions defaults() {
        return DEFAULTS;
    }

    /**
     Builds the options for a substitution, merging the given values over the defaults.
     * @param given option values as written in the prompt; may be {@code null}.

     @return the merged options.
     @throws ParsingException if a schedule key carries a non-numeric value or
     {@code shape_freedom} lies outside {@code [0,1]}.
     */
    public static SwapOptions of(Map<String, OptionValue> given) {
        if (given == null || given.isEmpty()) {
            return DEFAULTS;
        }
        Map<String, OptionValue> remaining = new LinkedHashMap<>(given);
        for (Map.Entry<String, OptionValue> entry : remaining.entrySet()) {
            if (NUMERIC_KEYS.contains(entry.getKey()) && !(entry.getValue() instanceof OptionValue.NumberValue)) {
                throw new ParsingException("Swap option '" + entry.getKey() + "' requires a number", entry.getKey());
            }
        }

        Map<String, OptionValue> merged = defaultValues();
        OptionValue shapeFreedom = remaining.remove(SHAPE_FREEDOM);
        if (shapeFreedom != null) {
            double freedom = ((OptionValue.NumberValue) shapeFreedom).value();
            if (freedom < 0.0 || freedom > 1.0) {
                throw new ParsingException("shape_freedom must be between 0 and 1, got " + freedom, SHAPE_FREEDOM);
            }
            merged.put(S_END, OptionValue.of(1.0 - Math.pow(freedom, 1.0 / 3.0)));
        }
        merged.putAll(remaining);
        return new SwapOptions(merged);
    }

    private static Map<String, OptionValue> defaultValues() {
        Map<String, OptionValue> defaults = new LinkedHashMap<>();
        defaults.put(S_START, OptionValue.of(0.0));
        defaults.put(S_END, OptionValue.of(DEFAULT_S_END));
        defaults.put(T_START, OptionValue.of(0.0));
        defaults.put(T_END, OptionValue.of(1.0));
        return defaults;
    }

    // ------------------------------------------------------------------------
    // Accessors
    // ------------------------------------------------------------------------

    public double sStart() {
        return number(S_START);
    }

    public double sEnd() {
        return number(S_END);
    }

    public double tStart() {
        return number(T_START);
    }

    public double tEnd() {
        return number(T_END);
    }

    public Optional<OptionValue> get(String key) {
        return Optional.ofNullable(values.get(key));
    }

    public boolean isFlagSet(String key) {
        return values.get(key) instanceof OptionValue.FlagValue flag && flag.value();
    }

    public Map<String, OptionValue> asMap() {
        return values;
    }

    private double number(String key) {
        return ((OptionValue.NumberValue) values.get(key)).value();
    }

    // ------------------------------------------------------------------------
    // Object
    // ------------------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SwapOptions)) return false;
        return values.equals(((SwapOptions) o).values);
    }

    @Override
    public int hashCode() {
        return values.hashCode();
    }

    @Override
    public String toString() {
        return "SwapOptions" + values;
    }
}
