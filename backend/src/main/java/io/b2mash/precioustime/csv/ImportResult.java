package io.b2mash.precioustime.csv;

public record ImportResult(int created, int updated) {

  public int total() {
    return created + updated;
  }
}
