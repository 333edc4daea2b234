package io.lazytable.storage;

import java.util.Objects;

/**
 * Either a materialized page or the reason it could not be built.
 */
public sealed interface PageResult {

    boolean isBuilt();

    record Built(Page page) implements PageResult {
        public Built {
            Objects.requireNonNull(page, "page");
        }

        @Override
        public boolean isBuilt() {
            return true;
        }
    }

    record Failed(BuildFailure failure) implements PageResult {
        public Failed {
            Objects.requireNonNull(failure, "failure");
        }

        @Override
        public boolean isBuilt() {
            return false;
        }
    }
}
