package com.cario.docintel.app.model;

import java.util.ArrayList;
import java.util.List;
import lombok.Builder;
import lombok.Value;

/**
 * A single recognized line of text.
 *
 * <p>Confidence is on the 0..1 scale. The polygon always has four corners when the provider
 * reported any geometry; a bare bbox is expanded to its four corners.
 */
@Value
@Builder
public class TextLine {

  /** Recognized text, trimmed. */
  String text;

  /** Line confidence in [0, 1]. */
  double confidence;

  /** Axis-aligned box {@code [x1, y1, x2, y2]}, or empty when the provider sent none. */
  List<Double> bbox;

  /** Bounding quadrilateral, clockwise from top-left, or empty when unknown. */
  List<Point> polygon;

  /** Expands an {@code [x1, y1, x2, y2]} box into its four corners. */
  public static List<Point> polygonFromBbox(List<Double> bbox) {
    if (bbox == null || bbox.size() < 4) {
      return List.of();
    }
    double x1 = bbox.get(0);
    double y1 = bbox.get(1);
    double x2 = bbox.get(2);
    double y2 = bbox.get(3);
    List<Point> corners = new ArrayList<>(4);
    corners.add(new Point(x1, y1));
    corners.add(new Point(x2, y1));
    corners.add(new Point(x2, y2));
    corners.add(new Point(x1, y2));
    return List.copyOf(corners);
  }
}
