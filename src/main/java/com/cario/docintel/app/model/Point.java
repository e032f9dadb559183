package com.cario.docintel.app.model;

import lombok.Value;

/** One corner of a line's bounding quadrilateral, in provider page coordinates. */
@Value
public class Point {
  double x;
  double y;
}
