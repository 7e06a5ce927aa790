package practice.gof.structural.flyweight;

// extrinsic state: position only, the type is a shared reference
record Tree(int x, int y, TreeType type) {
  String draw() {
    return type.draw(x, y);
  }
}
