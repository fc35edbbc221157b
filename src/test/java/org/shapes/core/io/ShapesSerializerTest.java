package org.shapes.core.io;

import org.junit.Test;
import org.shapes.core.model.CannonProperties;
import org.shapes.core.model.FragmentProperties;
import org.shapes.core.model.Port;
import org.shapes.core.model.PortType;
import org.shapes.core.model.Scale;
import org.shapes.core.model.Shape;
import org.shapes.core.model.ShapesFile;
import org.shapes.core.model.ShroudComponent;
import org.shapes.core.model.ThrusterProperties;
import org.shapes.core.model.Vertex;
import org.shapes.core.model.config.ShapesSettings;
import org.shapes.core.parse.StrictShapesParser;

import java.util.ArrayList;
import java.util.List;

import static org.junit.Assert.*;

public class ShapesSerializerTest {

    private static Scale triangle() {
        return new Scale(
                new ArrayList<>(List.of(new Vertex(0, 0), new Vertex(10, 0), new Vertex(0, -7.5))),
                new ArrayList<>(List.of(new Port(0, 0.5), new Port(1, 0.25, PortType.THRUSTER_IN))));
    }

    private static ShapesFile single(Shape shape) {
        ShapesFile file = new ShapesFile();
        file.shapes.add(shape);
        return file;
    }

    private static Shape fullyLoaded() {
        Shape shape = new Shape(4200, "Heavy Cannon");
        shape.scales.add(triangle());
        shape.scales.add(new Scale(
                new ArrayList<>(List.of(new Vertex(-1.5, -1.5), new Vertex(1.5, -1.5), new Vertex(1.5, 1.5))),
                new ArrayList<>(List.of(new Port(2, 0.5, PortType.WEAPON_OUT)))));

        shape.group = 7;
        shape.features = new ArrayList<>(List.of("CANNON", "TURRET"));
        shape.fillColor = 0x00113077;
        shape.fillColor1 = 0x7f000000;
        shape.lineColor = 0xffffffff;
        shape.durability = 2.5;
        shape.density = 0.1;
        shape.growRate = 1e-4;
        shape.launcherRadial = Boolean.FALSE;
        shape.mirrorOf = 4201;

        ShroudComponent shroud = new ShroudComponent();
        shroud.sizeX = 2;
        shroud.sizeY = 3.25;
        shroud.offsetX = -1;
        shroud.offsetY = 0.5;
        shroud.offsetZ = 0;
        shroud.taper = 0.75;
        shroud.count = 3;
        shroud.angle = -45;
        shroud.triColorId = 1;
        shroud.triColor1Id = 2;
        shroud.lineColorId = 3;
        shroud.shape = 4200;
        shape.shroud = new ArrayList<>(List.of(shroud));

        CannonProperties cannon = new CannonProperties();
        cannon.damage = 120;
        cannon.power = 8;
        cannon.roundsPerSec = 1.5;
        cannon.muzzleVel = 1400;
        cannon.range = 2500;
        cannon.spread = 0.02;
        cannon.roundsPerBurst = 2;
        cannon.burstyness = 0.5;
        cannon.color = 0xffff8800;
        cannon.explosive = "FINAL|PROXIMITY";
        FragmentProperties fragment = new FragmentProperties();
        fragment.roundsPerBurst = 12;
        fragment.muzzleVel = 400;
        fragment.spread = 3.14159;
        fragment.pattern = "CONSTANT \"ring\"";
        fragment.damage = 10;
        fragment.range = 150;
        fragment.color = 0x10203040;
        cannon.fragment = fragment;
        shape.cannon = cannon;

        ThrusterProperties thruster = new ThrusterProperties();
        thruster.force = 15000;
        thruster.power = 2.75;
        thruster.color = 0xffaa5500;
        shape.thruster = thruster;
        return shape;
    }

    @Test
    public void colorIsWrittenAsEightHexDigits() {
        Shape shape = new Shape(100);
        shape.scales.add(triangle());
        shape.fillColor = 0x113077;

        String text = ShapesSerializer.serialize(single(shape));
        assertTrue(text, text.contains("fillColor = 0x00113077"));
    }

    @Test
    public void writesCanonicalLayout() {
        Shape shape = new Shape(5001, "Square");
        shape.scales.add(new Scale(
                new ArrayList<>(List.of(new Vertex(5, -5), new Vertex(-5, -5))),
                new ArrayList<>(List.of(new Port(0, 0.5), new Port(1, 0.5, PortType.THRUSTER_OUT)))));

        String expected = "{\n"
                + "    {5001, --Square\n"
                + "        {\n"
                + "            {\n"
                + "                verts = {\n"
                + "                    {5, -5},\n"
                + "                    {-5, -5},\n"
                + "                },\n"
                + "                ports = {\n"
                + "                    {0, 0.5},\n"
                + "                    {1, 0.5, THRUSTER_OUT},\n"
                + "                }\n"
                + "            }, --scale 1\n"
                + "        }\n"
                + "    }\n"
                + "}\n";
        assertEquals(expected, ShapesSerializer.serialize(single(shape)));
    }

    @Test
    public void emptyScaleListsAndEmptyFile() {
        Shape shape = new Shape(1);
        shape.scales.add(new Scale());
        String text = ShapesSerializer.serialize(single(shape));
        assertTrue(text.contains("verts = {},"));
        assertTrue(text.contains("ports = {}\n"));

        assertEquals("{\n}\n", ShapesSerializer.serialize(new ShapesFile()));
        assertEquals("{\n}\n", ShapesSerializer.serialize(null));
    }

    @Test
    public void annotationsFollowSettings() {
        Shape shape = new Shape(1);
        shape.scales.add(triangle());

        ShapesSettings settings = new ShapesSettings();
        settings.annotatePorts = true;
        settings.annotateScales = false;
        String text = ShapesSerializer.serialize(single(shape), settings);

        assertTrue(text.contains("{1, 0.25, THRUSTER_IN},  -- Edge 1, position 0.25, type THRUSTER_IN"));
        assertFalse(text.contains("--scale"));
        assertFalse(text.contains("{0, 0.5},  --"));
    }

    @Test
    public void optionalPropertiesComeInFixedOrder() {
        String text = ShapesSerializer.serialize(single(fullyLoaded()));
        String[] order = {"group =", "features =", "fillColor =", "fillColor1 =", "lineColor =", "durability =",
                "density =", "growRate =", "launcher_radial =", "mirror_of =", "shroud =", "cannon =", "thruster ="};
        int last = -1;
        for (String key : order) {
            int idx = text.indexOf(key);
            assertTrue(key + " missing", idx >= 0);
            assertTrue(key + " out of order", idx > last);
            last = idx;
        }
        assertTrue(text.contains("launcher_radial = false,"));
        assertTrue(text.contains("explosive = FINAL|PROXIMITY,"));
        assertTrue(text.contains("features = \"CANNON|TURRET\","));
        assertTrue(text.contains("lineColor = 0xffffffff,"));
    }

    @Test
    public void absentOptionalsAreNotWritten() {
        Shape shape = new Shape(1);
        shape.scales.add(triangle());
        String text = ShapesSerializer.serialize(single(shape));
        assertFalse(text.contains("durability"));
        assertFalse(text.contains("launcher_radial"));
        assertFalse(text.contains("cannon"));
    }

    @Test
    public void fullModelSurvivesStrictRoundTrip() throws Exception {
        Shape plain = new Shape(101, "[[wip");
        plain.scales.add(triangle());

        ShapesFile model = new ShapesFile();
        model.shapes.add(fullyLoaded());
        model.shapes.add(plain);

        String text = ShapesSerializer.serialize(model);
        ShapesFile parsed = new StrictShapesParser().parse(text);
        assertEquals(model, parsed);

        // повторная запись даёт тот же текст
        assertEquals(text, ShapesSerializer.serialize(parsed));
    }

    @Test
    public void nameStartingWithBracketStaysLineComment() {
        Shape shape = new Shape(5001, "[[wip");
        shape.scales.add(triangle());
        String text = ShapesSerializer.serialize(single(shape));
        assertTrue(text.contains("{5001, -- [[wip\n"));
    }

    @Test
    public void blankFeaturesAreDroppedOnWrite() throws Exception {
        Shape shape = new Shape(77);
        shape.scales.add(triangle());
        shape.features = new ArrayList<>(List.of("CANNON", " ", " TURRET "));

        String text = ShapesSerializer.serialize(single(shape));
        assertTrue(text.contains("features = \"CANNON|TURRET\","));

        Shape parsed = new StrictShapesParser().parse(text).shapes.get(0);
        assertEquals(List.of("CANNON", "TURRET"), parsed.features);
    }

    @Test
    public void numberFormatting() {
        assertEquals("5", ShapesSerializer.fmt(5.0));
        assertEquals("-5", ShapesSerializer.fmt(-5.0));
        assertEquals("0.5", ShapesSerializer.fmt(0.5));
        assertEquals("100", ShapesSerializer.fmt(100.0));
        assertEquals("0.0001", ShapesSerializer.fmt(1e-4));
        assertEquals("0", ShapesSerializer.fmt(0.0));
        assertEquals("-0", ShapesSerializer.fmt(-0.0));
        assertEquals("0x00000000", ShapesSerializer.hex(0));
        assertEquals("0xff0a0b0c", ShapesSerializer.hex(0xff0a0b0c));
        assertEquals("\"a\\\"b\"", ShapesSerializer.quote("a\"b"));
    }
}
