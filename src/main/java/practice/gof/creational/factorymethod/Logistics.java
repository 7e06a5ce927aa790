package practice.gof.creational.factorymethod;

import java.util.Locale;

abstract class Logistics {
  // factory method
  abstract Transport createTransport();

  final String planDelivery(String cargo) {
    Transport transport = createTransport();
    return transport.deliver(cargo);
  }

  static Logistics forRoute(String route) {
    if (route == null || route.isBlank()) {
      throw new IllegalArgumentException("route must not be blank: " + route);
    }
    switch (route.toLowerCase(Locale.ROOT)) {
      case "road":
        return new RoadLogistics();
      case "sea":
        return new SeaLogistics();
      default:
        throw new IllegalArgumentException("unknown route: " + route);
    }
  }
}
