package practice.gof;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import practice.gof.creational.abstractfactory.AbstractFactoryDemo;
import practice.gof.creational.builder.BuilderDemo;
import practice.gof.creational.factorymethod.FactoryMethodDemo;
import practice.gof.creational.prototype.PrototypeDemo;
import practice.gof.creational.singleton.SingletonDemo;
import practice.gof.structural.adapter.AdapterDemo;
import practice.gof.structural.bridge.BridgeDemo;
import practice.gof.structural.composite.CompositeDemo;
import practice.gof.structural.decorator.DecoratorDemo;
import practice.gof.structural.facade.FacadeDemo;
import practice.gof.structural.flyweight.FlyweightDemo;
import practice.gof.structural.proxy.ProxyDemo;

/** The catalogue: one entry per pattern, in the order they are presented. */
public enum Pattern {
  SINGLETON(
      "Singleton",
      Category.CREATIONAL,
      "Ensures a class has only one instance and provides "
          + "a global point of access to it.",
      SingletonDemo::run),
  FACTORY_METHOD(
      "Factory Method",
      Category.CREATIONAL,
      "Defines an interface for creating an object but lets "
          + "subclasses decide which class to instantiate.",
      FactoryMethodDemo::run),
  ABSTRACT_FACTORY(
      "Abstract Factory",
      Category.CREATIONAL,
      "Provides an interface for creating families of related "
          + "objects without naming their concrete classes.",
      AbstractFactoryDemo::run),
  BUILDER(
      "Builder",
      Category.CREATIONAL,
      "Separates the construction of a complex object from its "
          + "representation so it can be built step by step.",
      BuilderDemo::run),
  PROTOTYPE(
      "Prototype",
      Category.CREATIONAL,
      "Creates new objects by copying an existing instance "
          + "instead of building them from scratch.",
      PrototypeDemo::run),
  ADAPTER(
      "Adapter",
      Category.STRUCTURAL,
      "Converts the interface of a class into another interface that clients expect.",
      AdapterDemo::run),
  BRIDGE(
      "Bridge",
      Category.STRUCTURAL,
      "Decouples an abstraction from its implementation so "
          + "that the two can vary independently.",
      BridgeDemo::run),
  COMPOSITE(
      "Composite",
      Category.STRUCTURAL,
      "Composes objects into tree structures and lets clients "
          + "treat single objects and groups uniformly.",
      CompositeDemo::run),
  DECORATOR(
      "Decorator",
      Category.STRUCTURAL,
      "Attaches additional responsibilities to an object dynamically by wrapping it.",
      DecoratorDemo::run),
  FACADE(
      "Facade",
      Category.STRUCTURAL,
      "Provides a single simplified interface to a set of interfaces in a subsystem.",
      FacadeDemo::run),
  FLYWEIGHT(
      "Flyweight",
      Category.STRUCTURAL,
      "Shares common state between many fine-grained objects to "
          + "support large numbers of them efficiently.",
      FlyweightDemo::run),
  PROXY(
      "Proxy",
      Category.STRUCTURAL,
      "Provides a surrogate or placeholder for another object to control access to it.",
      ProxyDemo::run);

  private final String displayName;
  private final Category category;
  private final String overview;
  private final PatternDemo demo;

  Pattern(String displayName, Category category, String overview, PatternDemo demo) {
    this.displayName = displayName;
    this.category = category;
    this.overview = overview;
    this.demo = demo;
  }

  public String displayName() {
    return displayName;
  }

  public Category category() {
    return category;
  }

  public String overview() {
    return overview;
  }

  public String slug() {
    return name().toLowerCase(Locale.ROOT).replace('_', '-');
  }

  public void runDemo(PrintStream out) {
    demo.run(out);
  }

  public String demoOutput() {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8)) {
      demo.run(out);
    }
    return buffer.toString(StandardCharsets.UTF_8);
  }

  public static List<Pattern> byCategory(Category category) {
    return Arrays.stream(values()).filter(pattern -> pattern.category == category).toList();
  }

  /**
   * Accepts the display name ("Factory Method"), the constant name ("FACTORY_METHOD") or the slug
   * ("factory-method"), ignoring case.
   */
  public static Pattern fromName(String name) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("pattern name must not be blank");
    }
    String normalized = name.trim().toLowerCase(Locale.ROOT).replace('_', '-').replace(' ', '-');
    for (Pattern pattern : values()) {
      if (pattern.slug().equals(normalized)) {
        return pattern;
      }
    }
    List<String> known = Arrays.stream(values()).map(Pattern::slug).toList();
    throw new IllegalArgumentException("unknown pattern: " + name + " (known: " + known + ")");
  }
}
