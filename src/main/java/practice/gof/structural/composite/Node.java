package practice.gof.structural.composite;

import java.util.List;

interface Node {
  String name();

  long size();

  List<String> render();
}
