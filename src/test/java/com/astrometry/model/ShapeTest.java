package com.astrometry.model;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link Shape} class.
 */
public class ShapeTest {

    @Test
    public void testBoxBoundsRoundHalfUp() {
        Shape box = Shape.box(100.0, 100.0, 3.5, 3.5);
        Assert.assertEquals(new PixelBounds(97, 97, 104, 104), box.getBoundingBox().round());
    }

    @Test
    public void testEllipseBoundsFollowRotation() {
        Shape ellipse = Shape.ellipse(50, 50, 10, 4, 90);
        BoundingBox box = ellipse.getBoundingBox();
        Assert.assertEquals(46, box.x1, 1e-9);
        Assert.assertEquals(54, box.x2, 1e-9);
        Assert.assertEquals(40, box.y1, 1e-9);
        Assert.assertEquals(60, box.y2, 1e-9);
        Assert.assertTrue(ellipse.contains(50, 59));
        Assert.assertFalse(ellipse.contains(59, 50));
    }

    @Test
    public void testCircleContainment() {
        Shape circle = Shape.circle(10, 10, 3);
        Assert.assertTrue(circle.contains(10, 13));
        Assert.assertTrue(circle.contains(12, 12));
        Assert.assertFalse(circle.contains(13, 13));
        Assert.assertFalse(circle.contains(Double.NaN, 10));
    }

    @Test
    public void testPolygonContainmentAndMove() {
        // L-shaped polygon
        Shape polygon = Shape.polygon(new double[]{0, 6, 6, 3, 3, 0}, new double[]{0, 0, 3, 3, 6, 6});
        Assert.assertTrue(polygon.contains(1, 5));
        Assert.assertTrue(polygon.contains(5, 1));
        Assert.assertFalse(polygon.contains(5, 5));

        PixelPoint c = polygon.getCenter();
        Assert.assertEquals(3.0, c.x, 1e-9);
        Assert.assertEquals(3.0, c.y, 1e-9);

        polygon.moveTo(13, 23);
        Assert.assertEquals(new PixelPoint(13, 23), polygon.getCenter());
        BoundingBox box = polygon.getBoundingBox();
        Assert.assertEquals(10, box.x1, 1e-9);
        Assert.assertEquals(26, box.y2, 1e-9);
        Assert.assertTrue(polygon.contains(11, 25));
    }

    @Test
    public void testRectangleCenterAndMove() {
        Shape rect = Shape.rectangle(12, 8, 2, 4);
        Assert.assertEquals(new PixelPoint(7, 6), rect.getCenter());
        BoundingBox box = rect.getBoundingBox();
        Assert.assertEquals(2, box.x1, 1e-9);
        Assert.assertEquals(4, box.y1, 1e-9);

        rect.moveTo(0, 0);
        Assert.assertEquals(-5, rect.getBoundingBox().x1, 1e-9);
        Assert.assertEquals(2, rect.getBoundingBox().y2, 1e-9);
    }

    @Test
    public void testPointAndLineAreNotRegions() {
        Assert.assertFalse(Shape.point(1, 1).getKind().isRegion());
        Assert.assertFalse(Shape.line(0, 0, 5, 5).getKind().isRegion());
        Assert.assertTrue(Shape.point(1, 1).getBoundingBox().round().isEmpty());
        Assert.assertFalse(Shape.line(0, 0, 5, 5).contains(2, 2));
    }

    @Test
    public void testOfFallsBackToBoxForPolygons() {
        Shape shape = Shape.of(Shape.Kind.POLYGON, 5, 5, 2, 3);
        Assert.assertEquals(Shape.Kind.BOX, shape.getKind());
        Assert.assertEquals(Shape.Kind.CIRCLE, Shape.of(Shape.Kind.CIRCLE, 5, 5, 2, 3).getKind());
    }

    @Test
    public void testKindFromLabel() {
        Assert.assertEquals(Shape.Kind.SQUAREBOX, Shape.Kind.fromLabel("squarebox"));
        Assert.assertEquals(Shape.Kind.FREEPOLYGON, Shape.Kind.fromLabel("FreePolygon"));
    }

    @Test(expected = IllegalArgumentException.class)
    public void testPolygonNeedsThreeVertices() {
        Shape.polygon(new double[]{0, 1}, new double[]{0, 1});
    }
}
