package io.fabricla.collector.model;

/** An entity whose collection stopped early, with the cause as class name and message. */
public record EntityFailure(String entity, EntityKind kind, String error, String message) {
    public static EntityFailure of(EntityRef ref, Throwable t) {
        return new EntityFailure(ref.toString(), ref.kind(), t.getClass().getSimpleName(), t.getMessage());
    }
}
