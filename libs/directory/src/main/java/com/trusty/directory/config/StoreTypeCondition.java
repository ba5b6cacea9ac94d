package com.trusty.directory.config;

import com.trusty.directory.config.DirectoryProperties.StoreType;
import org.springframework.boot.autoconfigure.condition.ConditionOutcome;
import org.springframework.boot.autoconfigure.condition.SpringBootCondition;
import org.springframework.boot.context.properties.bind.BindException;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.context.annotation.ConditionContext;
import org.springframework.core.type.AnnotatedTypeMetadata;

/**
 * Matches when {@code trusty.directory.store-type} binds to the given {@link StoreType}.
 *
 * <p>Binds the property the same way {@link DirectoryProperties} does, so every spelling the
 * properties accept ({@code in-memory}, {@code IN_MEMORY}, {@code in_memory}) selects the same
 * store. An absent property means {@link StoreType#JDBC}.
 */
abstract class StoreTypeCondition extends SpringBootCondition {

    static final String PROPERTY = "trusty.directory.store-type";

    private final StoreType expected;

    StoreTypeCondition(StoreType expected) {
        this.expected = expected;
    }

    @Override
    public ConditionOutcome getMatchOutcome(
            ConditionContext context, AnnotatedTypeMetadata metadata) {
        StoreType configured;
        try {
            configured =
                    Binder.get(context.getEnvironment())
                            .bind(PROPERTY, StoreType.class)
                            .orElse(StoreType.JDBC);
        } catch (BindException e) {
            return ConditionOutcome.noMatch(
                    "%s could not be bound: %s".formatted(PROPERTY, e.getMessage()));
        }
        return configured == expected
                ? ConditionOutcome.match("%s is %s".formatted(PROPERTY, configured))
                : ConditionOutcome.noMatch("%s is %s".formatted(PROPERTY, configured));
    }

    static final class Jdbc extends StoreTypeCondition {
        Jdbc() {
            super(StoreType.JDBC);
        }
    }

    static final class InMemory extends StoreTypeCondition {
        InMemory() {
            super(StoreType.IN_MEMORY);
        }
    }
}
