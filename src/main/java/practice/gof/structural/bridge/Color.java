package practice.gof.structural.bridge;

// implementor side of the bridge
interface Color {
  String name();
}
