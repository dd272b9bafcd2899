package net.vortexdevelopment.injekt.di.scan.fixtures;

public abstract class AbstractCache {

    public abstract String location();
}
