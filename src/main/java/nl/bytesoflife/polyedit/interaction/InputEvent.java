package nl.bytesoflife.polyedit.interaction;

import java.util.Set;

/**
 * Raw input delivered by the host UI. Pointer and wheel positions are in screen
 * pixels relative to the canvas origin.
 */
public sealed interface InputEvent permits InputEvent.PointerEvent, InputEvent.KeyEvent, InputEvent.WheelEvent {

    enum Button {
        LEFT,
        MIDDLE,
        RIGHT
    }

    enum Modifier {
        SHIFT,
        CTRL,
        ALT,
        META
    }

    enum KeyCode {
        ESCAPE,
        ENTER,
        DELETE,
        BACKSPACE,
        OTHER
    }

    Set<Modifier> modifiers();

    default boolean hasModifier(Modifier modifier) {
        return modifiers().contains(modifier);
    }

    record PointerEvent(Button button, double x, double y, Set<Modifier> modifiers) implements InputEvent {
        public PointerEvent {
            modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        }

        public PointerEvent(Button button, double x, double y) {
            this(button, x, y, Set.of());
        }
    }

    record KeyEvent(KeyCode key, Set<Modifier> modifiers) implements InputEvent {
        public KeyEvent {
            modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        }

        public KeyEvent(KeyCode key) {
            this(key, Set.of());
        }
    }

    record WheelEvent(double x, double y, double deltaX, double deltaY, Set<Modifier> modifiers) implements InputEvent {
        public WheelEvent {
            modifiers = modifiers == null ? Set.of() : Set.copyOf(modifiers);
        }

        /**
         * Ctrl (or Cmd) turns the wheel into a zoom gesture.
         */
        public boolean isZoom() {
            return hasModifier(Modifier.CTRL) || hasModifier(Modifier.META);
        }
    }
}
