package io.dcsim.shell.core.suggest;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

class EditDistanceTest {

  @Test
  void classicDistances() {
    assertEquals(0, EditDistance.between("query", "query"));
    assertEquals(3, EditDistance.between("kitten", "sitting"));
    assertEquals(2, EditDistance.between("qurey", "query"));
    assertEquals(5, EditDistance.between("", "query"));
    assertEquals(1, EditDistance.between("topoo", "topo"));
  }

  @Test
  void isSymmetric() {
    assertEquals(
        EditDistance.between("list-gpus", "lsit-gpu"),
        EditDistance.between("lsit-gpu", "list-gpus"));
  }

  @Test
  void similarityBounds() {
    assertEquals(1.0, EditDistance.similarity("", ""));
    assertEquals(1.0, EditDistance.similarity("id", "id"));
    assertEquals(0.0, EditDistance.similarity("ab", "cd"));
    assertEquals(0.6, EditDistance.similarity("qurey", "query"), 1e-9);
  }
}
