package practice.gof.creational.builder;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

final class Computer {
  private final String cpu;
  private final int ramGigabytes;
  private final List<String> storage;
  private final String graphicsCard;
  private final boolean wifi;

  private Computer(Builder builder) {
    this.cpu = builder.cpu;
    this.ramGigabytes = builder.ramGigabytes;
    this.storage = List.copyOf(builder.storage);
    this.graphicsCard = builder.graphicsCard;
    this.wifi = builder.wifi;
  }

  static Builder builder() {
    return new Builder();
  }

  String cpu() {
    return cpu;
  }

  int ramGigabytes() {
    return ramGigabytes;
  }

  List<String> storage() {
    return storage;
  }

  String graphicsCard() {
    return graphicsCard;
  }

  boolean wifi() {
    return wifi;
  }

  String describe() {
    return "Computer{cpu="
        + cpu
        + ", ram="
        + ramGigabytes
        + "GB, storage="
        + storage
        + ", graphicsCard="
        + (graphicsCard == null ? "onboard" : graphicsCard)
        + ", wifi="
        + wifi
        + "}";
  }

  static final class Builder {
    private String cpu;
    private int ramGigabytes;
    private final List<String> storage = new ArrayList<>();
    private String graphicsCard;
    private boolean wifi;

    private Builder() {}

    Builder cpu(String cpu) {
      this.cpu = Objects.requireNonNull(cpu, "cpu");
      return this;
    }

    Builder ramGigabytes(int ramGigabytes) {
      if (ramGigabytes <= 0) {
        throw new IllegalArgumentException("ram must be positive: " + ramGigabytes);
      }
      this.ramGigabytes = ramGigabytes;
      return this;
    }

    Builder addStorage(String drive) {
      storage.add(Objects.requireNonNull(drive, "drive"));
      return this;
    }

    Builder graphicsCard(String graphicsCard) {
      this.graphicsCard = graphicsCard;
      return this;
    }

    Builder wifi(boolean wifi) {
      this.wifi = wifi;
      return this;
    }

    Computer build() {
      if (cpu == null) {
        throw new IllegalStateException("cpu is required");
      }
      if (ramGigabytes == 0) {
        throw new IllegalStateException("ram is required");
      }
      return new Computer(this);
    }
  }
}
