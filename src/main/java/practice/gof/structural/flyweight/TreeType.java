package practice.gof.structural.flyweight;

// intrinsic state, shared between every tree of the same kind
record TreeType(String name, String color, String texture) {
  String draw(int x, int y) {
    return name + "[" + color + ", " + texture + "] at (" + x + ", " + y + ")";
  }
}
