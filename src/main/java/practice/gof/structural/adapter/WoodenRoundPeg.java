package practice.gof.structural.adapter;

record WoodenRoundPeg(double radius) implements RoundPeg {}
