package io.fullerstack.atom.demo;

/**
 * Demo configuration
 *
 * @param initialValue starting value of the counter atom
 * @param increment    amount added by the demo's update step
 */
public record DemoConfig(
    int initialValue,
    int increment
) {

    public static DemoConfig fromEnv() {
        return new DemoConfig(
            parse("DEMO_INITIAL_VALUE", System.getenv().getOrDefault("DEMO_INITIAL_VALUE", "0")),
            parse("DEMO_INCREMENT", System.getenv().getOrDefault("DEMO_INCREMENT", "10"))
        );
    }

    static int parse(String variable, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(variable + " must be an integer: " + value, e);
        }
    }
}
