package org.shapes.core.model;

import java.util.Objects;

/**
 * Декоративная деталь поверх блока (элемент списка shroud).
 */
public class ShroudComponent {

    public double sizeX;
    public double sizeY;

    public double offsetX;
    public double offsetY;
    /** угол смещения (третий элемент offset) */
    public double offsetZ;

    public double taper;
    public int count;
    public double angle;

    public int triColorId;
    public int triColor1Id;
    public int lineColorId;

    /** id формы, которой рисуется деталь */
    public int shape;

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShroudComponent)) return false;
        ShroudComponent c = (ShroudComponent) o;
        return Double.compare(sizeX, c.sizeX) == 0
                && Double.compare(sizeY, c.sizeY) == 0
                && Double.compare(offsetX, c.offsetX) == 0
                && Double.compare(offsetY, c.offsetY) == 0
                && Double.compare(offsetZ, c.offsetZ) == 0
                && Double.compare(taper, c.taper) == 0
                && count == c.count
                && Double.compare(angle, c.angle) == 0
                && triColorId == c.triColorId
                && triColor1Id == c.triColor1Id
                && lineColorId == c.lineColorId
                && shape == c.shape;
    }

    @Override
    public int hashCode() {
        return Objects.hash(sizeX, sizeY, offsetX, offsetY, offsetZ, count, shape);
    }
}
