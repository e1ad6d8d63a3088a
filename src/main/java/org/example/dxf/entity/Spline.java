package org.example.dxf.entity;

import org.example.dxf.schema.EntitySchema;
import org.example.dxf.tag.DxfPoint;
import org.example.dxf.tag.DxfTag;
import org.example.dxf.tag.DxfTagWriter;

import java.util.ArrayList;
import java.util.List;

/**
 * SPLINE：节点（40）、权重（41）、控制点（10）、拟合点（11）四个列表，数量属性（72/73/74）由列表计算。
 */
public class Spline extends DxfEntity {

    private static final String SUBCLASS = "AcDbSpline";
    private static final String DATA = "spline_data";

    private final List<Double> knots = new ArrayList<>();
    private final List<Double> weights = new ArrayList<>();
    private final List<DxfPoint> controlPoints = new ArrayList<>();
    private final List<DxfPoint> fitPoints = new ArrayList<>();

    public Spline(EntitySchema schema) {
        super(schema);
    }

    public List<Double> knots() {
        return knots;
    }

    public List<Double> weights() {
        return weights;
    }

    public List<DxfPoint> controlPoints() {
        return controlPoints;
    }

    public List<DxfPoint> fitPoints() {
        return fitPoints;
    }

    @Override
    protected Object computedValue(String name) {
        return switch (name) {
            case "n_knots" -> knots.size();
            case "n_control_points" -> controlPoints.size();
            case "n_fit_points" -> fitPoints.size();
            default -> null;
        };
    }

    @Override
    protected List<DxfTag> loadStructure(String subclass, List<DxfTag> tags) {
        if (!SUBCLASS.equals(subclass)) {
            return tags;
        }
        List<DxfTag> rest = new ArrayList<>();
        boolean marked = false;
        for (DxfTag tag : tags) {
            boolean data = true;
            switch (tag.code()) {
                case 40 -> knots.add(tag.doubleValue());
                case 41 -> weights.add(tag.doubleValue());
                case 10 -> controlPoints.add(tag.pointValue());
                case 11 -> fitPoints.add(tag.pointValue());
                default -> data = false;
            }
            if (!data) {
                rest.add(tag);
            } else if (!marked) {
                rest.add(slotMarker(DATA));
                marked = true;
            }
        }
        return rest;
    }

    @Override
    protected void exportSlot(String slot, DxfTagWriter w) {
        if (!DATA.equals(slot)) {
            return;
        }
        knots.forEach(k -> w.write(40, k));
        weights.forEach(wt -> w.write(41, wt));
        controlPoints.forEach(p -> w.writePoint(10, p, true));
        fitPoints.forEach(p -> w.writePoint(11, p, true));
    }
}
