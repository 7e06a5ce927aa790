package practice.gof.creational.builder;

// knows the construction steps for the preset models
final class ComputerDirector {
  Computer office() {
    return Computer.builder()
        .cpu("4-core")
        .ramGigabytes(8)
        .addStorage("256GB SSD")
        .wifi(true)
        .build();
  }

  Computer gaming() {
    return Computer.builder()
        .cpu("16-core")
        .ramGigabytes(32)
        .addStorage("1TB NVMe")
        .addStorage("2TB HDD")
        .graphicsCard("RTX")
        .wifi(true)
        .build();
  }
}
