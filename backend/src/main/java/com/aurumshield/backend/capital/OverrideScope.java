package com.aurumshield.backend.capital;

/**
 * What an override lifts: the whole block matrix for one level, or a single action key.
 */
public sealed interface OverrideScope permits OverrideScope.Global, OverrideScope.Action {

    OverrideScopeType type();

    /** The action key for ACTION scope, {@code null} for GLOBAL. */
    ControlAction actionKey();

    static OverrideScope global() {
        return Global.INSTANCE;
    }

    static OverrideScope action(ControlAction actionKey) {
        return new Action(actionKey);
    }

    record Global() implements OverrideScope {
        private static final Global INSTANCE = new Global();

        @Override
        public OverrideScopeType type() {
            return OverrideScopeType.GLOBAL;
        }

        @Override
        public ControlAction actionKey() {
            return null;
        }
    }

    record Action(ControlAction actionKey) implements OverrideScope {
        public Action {
            if (actionKey == null) {
                throw new IllegalArgumentException("ACTION-scoped override must specify an actionKey");
            }
        }

        @Override
        public OverrideScopeType type() {
            return OverrideScopeType.ACTION;
        }
    }
}
