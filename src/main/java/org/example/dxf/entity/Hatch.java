package org.example.dxf.entity;

import org.example.dxf.DxfStructureException;
import org.example.dxf.DxfVersion;
import org.example.dxf.schema.DxfAttr;
import org.example.dxf.schema.EntitySchema;
import org.example.dxf.schema.HandleReference;
import org.example.dxf.schema.ReferenceKind;
import org.example.dxf.tag.DxfPoint;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;
import org.example.dxf.tag.GroupCodes;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * HATCH：三段变长结构
 * <ul>
 *   <li>{@code paths}：边界路径（91 路径数，每条路径 92 标志 ...）</li>
 *   <li>{@code pattern}：图案定义线（78 线数），实心填充时不写出</li>
 *   <li>{@code seeds}：种子点（98 点数）</li>
 * </ul>
 * 渐变填充等 R2004 之后追加的数据作为未建模 tag 保留在种子点之后。
 */
public class Hatch extends DxfEntity {

    private static final String SUBCLASS = "AcDbHatch";
    private static final String PATHS = "paths";
    private static final String PATTERN = "pattern";
    private static final String SEEDS = "seeds";
    private static final Set<String> PATTERN_ATTRIBUTES = Set.of("pattern_angle", "pattern_scale", "pattern_double");

    private final List<HatchBoundaryPath> paths = new ArrayList<>();
    private final List<PatternLine> patternLines = new ArrayList<>();
    private final List<DxfPoint> seeds = new ArrayList<>();

    public Hatch(EntitySchema schema) {
        super(schema);
    }

    public List<HatchBoundaryPath> paths() {
        return paths;
    }

    public List<PatternLine> patternLines() {
        return patternLines;
    }

    public List<DxfPoint> seeds() {
        return seeds;
    }

    public boolean isSolidFill() {
        return getInt("solid_fill") == 1;
    }

    public void setSolidFill() {
        set("pattern_name", "SOLID");
        set("solid_fill", 1);
        patternLines.clear();
    }

    /**
     * 设置图案填充。
     *
     * @param lines 图案定义线（已按角度与比例换算）
     */
    public void setPatternFill(String name, double angle, double scale, List<PatternLine> lines) {
        set("pattern_name", name);
        set("solid_fill", 0);
        set("pattern_angle", angle);
        set("pattern_scale", scale);
        patternLines.clear();
        patternLines.addAll(lines);
    }

    @Override
    protected boolean isExported(DxfAttr attr, DxfVersion version) {
        return !(PATTERN_ATTRIBUTES.contains(attr.name()) && isSolidFill());
    }

    @Override
    protected void collectReferences(List<HandleReference> refs) {
        for (HatchBoundaryPath path : paths) {
            for (String h : path.sourceHandles()) {
                refs.add(new HandleReference(h, ReferenceKind.SOFT_POINTER, GroupCodes.OWNER));
            }
        }
    }

    // ---------------------------------------------------------------- 载入

    @Override
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        if (!SUBCLASS.equals(subclass)) {
            return tags;
        }
        List<DxfTag> rest = new ArrayList<>();
        TagCursor cursor = new TagCursor(tags, 0, "HATCH");
        boolean pathsDone = false;
        boolean patternDone = false;
        boolean seedsDone = false;
        while (cursor.hasNext()) {
            int code = cursor.peekCode();
            if (code == 91 && !pathsDone) {
                rest.add(slotMarker(PATHS));
                readPaths(cursor);
                pathsDone = true;
            } else if (code == 78 && !patternDone) {
                rest.add(slotMarker(PATTERN));
                readPattern(cursor);
                patternDone = true;
            } else if (code == 98 && !seedsDone) {
                rest.add(slotMarker(SEEDS));
                int count = cursor.expect(98).intValue();
                for (int i = 0; i < count; i++) {
                    seeds.add(cursor.expect(10).pointValue());
                }
                seedsDone = true;
            } else {
                rest.add(cursor.expect(code));
            }
        }
        return rest;
    }

    private void readPaths(TagCursor cursor) {
        int count = cursor.expect(91).intValue();
        for (int p = 0; p < count; p++) {
            int flags = cursor.expect(92).intValue();
            boolean hasBulge = false;
            boolean closed = false;
            List<HatchBoundaryPath.Vertex> vertices = new ArrayList<>();
            List<HatchEdge> edges = new ArrayList<>();
            if ((flags & HatchBoundaryPath.POLYLINE) != 0) {
                hasBulge = cursor.expect(72).intValue() != 0;
                closed = cursor.expect(73).intValue() != 0;
                int n = cursor.expect(93).intValue();
                for (int i = 0; i < n; i++) {
                    DxfPoint v = cursor.expect(10).pointValue();
                    DxfTag bulge = cursor.optional(42);
                    vertices.add(new HatchBoundaryPath.Vertex(v.x(), v.y(), bulge == null ? 0 : bulge.doubleValue()));
                }
            } else {
                int n = cursor.expect(93).intValue();
                for (int i = 0; i < n; i++) {
                    edges.add(readEdge(cursor, n - i - 1));
                }
            }
            List<String> sources = new ArrayList<>();
            DxfTag sourceCount = cursor.optional(97);
            if (sourceCount != null) {
                for (int i = 0; i < sourceCount.intValue(); i++) {
                    sources.add(cursor.expect(GroupCodes.OWNER).stringValue());
                }
            }
            paths.add(new HatchBoundaryPath(flags, hasBulge, closed, vertices, edges, sources));
        }
    }

    private HatchEdge readEdge(TagCursor cursor, int remaining) {
        DxfTag typeTag = cursor.expect(72);
        HatchEdge.EdgeType type = HatchEdge.EdgeType.fromCode(typeTag.intValue());
        if (type == null) {
            throw new DxfStructureException("HATCH 边类型未知：" + typeTag.intValue(), typeTag.line());
        }
        return switch (type) {
            case LINE -> new HatchEdge.Line(cursor.expect(10).pointValue(), cursor.expect(11).pointValue());
            case ARC -> new HatchEdge.Arc(cursor.expect(10).pointValue(), cursor.expect(40).doubleValue(),
                    cursor.expect(50).doubleValue(), cursor.expect(51).doubleValue(),
                    cursor.expect(73).intValue() != 0);
            case ELLIPSE -> new HatchEdge.Ellipse(cursor.expect(10).pointValue(), cursor.expect(11).pointValue(),
                    cursor.expect(40).doubleValue(), cursor.expect(50).doubleValue(),
                    cursor.expect(51).doubleValue(), cursor.expect(73).intValue() != 0);
            case SPLINE -> readSplineEdge(cursor, remaining);
        };
    }

    private HatchEdge readSplineEdge(TagCursor cursor, int remaining) {
        int degree = cursor.expect(94).intValue();
        boolean rational = cursor.expect(73).intValue() != 0;
        boolean periodic = cursor.expect(74).intValue() != 0;
        int knotCount = cursor.expect(95).intValue();
        int controlCount = cursor.expect(96).intValue();
        List<Double> knots = new ArrayList<>();
        for (int i = 0; i < knotCount; i++) {
            knots.add(cursor.expect(40).doubleValue());
        }
        List<DxfPoint> controlPoints = new ArrayList<>();
        List<Double> weights = new ArrayList<>();
        for (int i = 0; i < controlCount; i++) {
            controlPoints.add(cursor.expect(10).pointValue());
            DxfTag weight = cursor.optional(42);
            if (weight != null) {
                weights.add(weight.doubleValue());
            }
        }
        List<DxfPoint> fitPoints = new ArrayList<>();
        DxfPoint startTangent = null;
        DxfPoint endTangent = null;
        if (cursor.peekCode() == 97 && isFitData(cursor, remaining)) {
            int fitCount = cursor.expect(97).intValue();
            for (int i = 0; i < fitCount; i++) {
                fitPoints.add(cursor.expect(11).pointValue());
            }
            DxfTag start = cursor.optional(12);
            startTangent = start == null ? null : start.pointValue();
            DxfTag end = cursor.optional(13);
            endTangent = end == null ? null : end.pointValue();
        }
        return new HatchEdge.Spline(degree, rational, periodic, knots, controlPoints, weights, fitPoints,
                startTangent, endTangent);
    }

    /**
     * 样条边之后的 97 既可能是拟合点数（R2010+），也可能是路径的源边界对象数，按其后的 tag 区分。
     */
    private static boolean isFitData(TagCursor cursor, int remainingEdges) {
        int count = cursor.peek().intValue();
        int next = cursor.peekCode(1);
        if (count > 0) {
            return next == 11;
        }
        return next == 12 || next == 13 || next == 97 || remainingEdges > 0;
    }

    private void readPattern(TagCursor cursor) {
        int count = cursor.expect(78).intValue();
        for (int i = 0; i < count; i++) {
            double angle = cursor.expect(53).doubleValue();
            DxfPoint base = DxfPoint.of(cursor.expect(43).doubleValue(), cursor.expect(44).doubleValue());
            DxfPoint offset = DxfPoint.of(cursor.expect(45).doubleValue(), cursor.expect(46).doubleValue());
            int dashCount = cursor.expect(79).intValue();
            List<Double> dashes = new ArrayList<>();
            for (int d = 0; d < dashCount; d++) {
                dashes.add(cursor.expect(49).doubleValue());
            }
            patternLines.add(new PatternLine(angle, base, offset, dashes));
        }
    }

    // ---------------------------------------------------------------- 写出

    @Override
    protected void exportSlot(String slot, DxfTagWriter w) {
        switch (slot) {
            case PATHS -> exportPaths(w);
            case PATTERN -> {
                if (!isSolidFill()) {
                    w.write(78, patternLines.size());
                    for (PatternLine line : patternLines) {
                        w.write(53, line.angle());
                        w.write(43, line.base().x());
                        w.write(44, line.base().y());
                        w.write(45, line.offset().x());
                        w.write(46, line.offset().y());
                        w.write(79, line.dashes().size());
                        line.dashes().forEach(d -> w.write(49, d));
                    }
                }
            }
            case SEEDS -> {
                w.write(98, seeds.size());
                seeds.forEach(p -> w.writePoint(10, p, false));
            }
            default -> {
            }
        }
    }

    private void exportPaths(DxfTagWriter w) {
        w.write(91, paths.size());
        for (HatchBoundaryPath path : paths) {
            w.write(92, path.flags());
            if (path.isPolyline()) {
                w.write(72, path.hasBulge() ? 1 : 0);
                w.write(73, path.closed() ? 1 : 0);
                w.write(93, path.vertices().size());
                for (HatchBoundaryPath.Vertex v : path.vertices()) {
                    w.writePoint(10, DxfPoint.of(v.x(), v.y()), false);
                    if (path.hasBulge()) {
                        w.write(42, v.bulge());
                    }
                }
            } else {
                w.write(93, path.edges().size());
                path.edges().forEach(e -> exportEdge(e, w));
            }
            w.write(97, path.sourceHandles().size());
            path.sourceHandles().forEach(h -> w.write(GroupCodes.OWNER, h));
        }
    }

    private static void exportEdge(HatchEdge edge, DxfTagWriter w) {
        w.write(72, edge.type().code());
        if (edge instanceof HatchEdge.Line line) {
            w.writePoint(10, line.start(), false);
            w.writePoint(11, line.end(), false);
        } else if (edge instanceof HatchEdge.Arc arc) {
            w.writePoint(10, arc.center(), false);
            w.write(40, arc.radius());
            w.write(50, arc.startAngle());
            w.write(51, arc.endAngle());
            w.write(73, arc.ccw() ? 1 : 0);
        } else if (edge instanceof HatchEdge.Ellipse ellipse) {
            w.writePoint(10, ellipse.center(), false);
            w.writePoint(11, ellipse.majorAxis(), false);
            w.write(40, ellipse.ratio());
            w.write(50, ellipse.startAngle());
            w.write(51, ellipse.endAngle());
            w.write(73, ellipse.ccw() ? 1 : 0);
        } else if (edge instanceof HatchEdge.Spline spline) {
            exportSplineEdge(spline, w);
        }
    }

    private static void exportSplineEdge(HatchEdge.Spline spline, DxfTagWriter w) {
        w.write(94, spline.degree());
        w.write(73, spline.rational() ? 1 : 0);
        w.write(74, spline.periodic() ? 1 : 0);
        w.write(95, spline.knots().size());
        w.write(96, spline.controlPoints().size());
        spline.knots().forEach(k -> w.write(40, k));
        List<DxfPoint> points = spline.controlPoints();
        for (int i = 0; i < points.size(); i++) {
            w.writePoint(10, points.get(i), false);
            if (i < spline.weights().size()) {
                w.write(42, spline.weights().get(i));
            }
        }
        boolean tangents = spline.startTangent() != null || spline.endTangent() != null;
        if (w.version().isAtLeast(DxfVersion.R2010) || !spline.fitPoints().isEmpty() || tangents) {
            w.write(97, spline.fitPoints().size());
            spline.fitPoints().forEach(p -> w.writePoint(11, p, false));
            if (spline.startTangent() != null) {
                w.writePoint(12, spline.startTangent(), false);
            }
            if (spline.endTangent() != null) {
                w.writePoint(13, spline.endTangent(), false);
            }
        }
    }
}
