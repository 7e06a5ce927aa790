package practice.gof.structural.adapter;

// what RoundHole understands
interface RoundPeg {
  double radius();
}
