package practice.gof.structural.proxy;

interface Image {
  String fileName();

  String display();
}
