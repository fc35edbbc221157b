package org.shapes.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Содержимое shapes.lua: формы в исходном порядке. Уникальность id здесь не проверяется.
 */
public class ShapesFile {

    public List<Shape> shapes = new ArrayList<>();

    public ShapesFile() {
    }

    public ShapesFile(List<Shape> shapes) {
        this.shapes = shapes;
    }

    public boolean isEmpty() {
        return shapes.isEmpty();
    }

    public int scaleCount() {
        int n = 0;
        for (Shape s : shapes) n += s.scales.size();
        return n;
    }

    public Shape findById(int id) {
        for (Shape s : shapes) {
            if (s.id == id) return s;
        }
        return null;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ShapesFile)) return false;
        return Objects.equals(shapes, ((ShapesFile) o).shapes);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(shapes);
    }
}
