package org.shapes.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Определение одной формы блока.
 *
 * Правила:
 * - id ожидается в диапазоне 100..10000, но здесь не проверяется.
 * - name берётся из комментария на строке с id и может отсутствовать (null).
 * - Необязательные целые/строковые/табличные поля: null = "не задано".
 * - Необязательные вещественные поля: Double.NaN = "не задано".
 * - mirrorOf - только ссылка по id, существование формы не проверяется.
 */
public class Shape {

    // --- Идентификация ---
    public int id;
    public String name;

    // --- Геометрия ---
    public List<Scale> scales = new ArrayList<>();

    // --- Флаги ---
    public Boolean launcherRadial;
    public Integer mirrorOf;
    public Integer group;
    public List<String> features;

    // --- Цвета (упакованный 32-битный ARGB) ---
    public Integer fillColor;
    public Integer fillColor1;
    public Integer lineColor;

    // --- Физика ---
    public double durability = Double.NaN;
    public double density = Double.NaN;
    public double growRate = Double.NaN;

    // --- Вложенные блоки ---
    public List<ShroudComponent> shroud;
    public CannonProperties cannon;
    public ThrusterProperties thruster;

    public Shape(int id) {
        this.id = id;
    }

    public Shape(int id, String name) {
        this.id = id;
        this.name = name;
    }

    public boolean isLauncherRadial() {
        return Boolean.TRUE.equals(launcherRadial);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Shape)) return false;
        Shape s = (Shape) o;
        return id == s.id
                && Objects.equals(name, s.name)
                && Objects.equals(scales, s.scales)
                && Objects.equals(launcherRadial, s.launcherRadial)
                && Objects.equals(mirrorOf, s.mirrorOf)
                && Objects.equals(group, s.group)
                && Objects.equals(features, s.features)
                && Objects.equals(fillColor, s.fillColor)
                && Objects.equals(fillColor1, s.fillColor1)
                && Objects.equals(lineColor, s.lineColor)
                && Double.compare(durability, s.durability) == 0
                && Double.compare(density, s.density) == 0
                && Double.compare(growRate, s.growRate) == 0
                && Objects.equals(shroud, s.shroud)
                && Objects.equals(cannon, s.cannon)
                && Objects.equals(thruster, s.thruster);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, name, scales, launcherRadial, mirrorOf, group);
    }

    @Override
    public String toString() {
        return "Shape{id=" + id + ", name=" + name + ", scales=" + scales.size() + "}";
    }
}
