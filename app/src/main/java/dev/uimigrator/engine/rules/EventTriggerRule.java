package dev.uimigrator.engine.rules;

import dev.uimigrator.diagnostics.DiagnosticCodes;
import dev.uimigrator.engine.ElementRule;
import dev.uimigrator.engine.TransformationContext;
import dev.uimigrator.model.MarkupElement;
import java.util.Optional;

/**
 * Event triggers drive storyboards, which map to style animations or behaviors only by hand.
 */
public class EventTriggerRule extends ElementRule {

    @Override
    public String name() {
        return "FlagEventTrigger";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean canHandleElement(MarkupElement element) {
        return element.isType("EventTrigger");
    }

    @Override
    public Optional<MarkupElement> transformElement(MarkupElement element, TransformationContext context) {
        String routedEvent = element.literal("RoutedEvent").orElse("?");
        context.warn(element, DiagnosticCodes.EVENT_TRIGGER_UNSUPPORTED,
                "EventTrigger on " + routedEvent + " has no direct equivalent; use style animations or behaviors");
        return Optional.of(element);
    }
}
