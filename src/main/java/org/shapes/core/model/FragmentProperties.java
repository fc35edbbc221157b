package org.shapes.core.model;

import java.util.Objects;

public class FragmentProperties {

    public int roundsPerBurst;
    public double muzzleVel;
    public double spread;
    public String pattern;
    public double damage;
    public double range;
    public Integer color;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FragmentProperties)) return false;
        FragmentProperties f = (FragmentProperties) o;
        return roundsPerBurst == f.roundsPerBurst
                && Double.compare(muzzleVel, f.muzzleVel) == 0
                && Double.compare(spread, f.spread) == 0
                && Objects.equals(pattern, f.pattern)
                && Double.compare(damage, f.damage) == 0
                && Double.compare(range, f.range) == 0
                && Objects.equals(color, f.color);
    }

    @Override
    public int hashCode() {
        return Objects.hash(roundsPerBurst, muzzleVel, spread, pattern, damage, range, color);
    }
}
