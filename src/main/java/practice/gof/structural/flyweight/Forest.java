package practice.gof.structural.flyweight;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

final class Forest {
  private final TreeTypeFactory factory;
  private final List<Tree> trees = new ArrayList<>();

  Forest(TreeTypeFactory factory) {
    this.factory = factory;
  }

  Tree plant(int x, int y, String name, String color, String texture) {
    Tree tree = new Tree(x, y, factory.get(name, color, texture));
    trees.add(tree);
    return tree;
  }

  List<Tree> trees() {
    return Collections.unmodifiableList(trees);
  }

  List<String> draw() {
    return trees.stream().map(Tree::draw).toList();
  }
}
