package io.b2mash.precioustime.timeentry;

/** A running entry has no end time; a closed one does. */
public enum EntryState {
  RUNNING,
  CLOSED
}
