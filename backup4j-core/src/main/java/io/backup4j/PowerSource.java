package io.backup4j;

/**
 * Reports whether the machine currently runs on battery.
 */
@FunctionalInterface
public interface PowerSource {

    boolean onBattery();

    static PowerSource mains() {
        return () -> false;
    }
}
