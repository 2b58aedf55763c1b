package com.meltwater.syncrabbit.flags;

import java.util.Objects;

/**
 * Conditions under which a queue or exchange delete is allowed to go through.
 */
public class DeleteOptions {

    public final boolean ifUnused;
    public final boolean ifEmpty;

    public DeleteOptions(boolean ifUnused, boolean ifEmpty) {
        this.ifUnused = ifUnused;
        this.ifEmpty = ifEmpty;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        DeleteOptions that = (DeleteOptions) o;
        return ifUnused == that.ifUnused && ifEmpty == that.ifEmpty;
    }

    @Override
    public int hashCode() {
        return Objects.hash(ifUnused, ifEmpty);
    }

    @Override
    public String toString() {
        return "{ifUnused:" + ifUnused + ", ifEmpty:" + ifEmpty + '}';
    }
}
