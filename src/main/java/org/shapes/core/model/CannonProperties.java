package org.shapes.core.model;

import java.util.Objects;

/**
 * Баллистика пушки. fragment принадлежит только этой пушке.
 */
public class CannonProperties {

    public double damage;
    public double power;
    public double roundsPerSec;
    public double muzzleVel;
    public double range;
    public double spread;

    // --- необязательные ---
    public Integer roundsPerBurst;
    public double burstyness = Double.NaN;
    public Integer color;
    /** например "PROXIMITY" или "FINAL|PROXIMITY" */
    public String explosive;
    public FragmentProperties fragment;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof CannonProperties)) return false;
        CannonProperties c = (CannonProperties) o;
        return Double.compare(damage, c.damage) == 0
                && Double.compare(power, c.power) == 0
                && Double.compare(roundsPerSec, c.roundsPerSec) == 0
                && Double.compare(muzzleVel, c.muzzleVel) == 0
                && Double.compare(range, c.range) == 0
                && Double.compare(spread, c.spread) == 0
                && Objects.equals(roundsPerBurst, c.roundsPerBurst)
                && Double.compare(burstyness, c.burstyness) == 0
                && Objects.equals(color, c.color)
                && Objects.equals(explosive, c.explosive)
                && Objects.equals(fragment, c.fragment);
    }

    @Override
    public int hashCode() {
        return Objects.hash(damage, power, roundsPerSec, muzzleVel, range, spread, fragment);
    }
}
