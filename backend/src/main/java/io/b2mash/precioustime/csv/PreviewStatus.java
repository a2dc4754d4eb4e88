package io.b2mash.precioustime.csv;

public enum PreviewStatus {
  NEW,
  UPDATED
}
