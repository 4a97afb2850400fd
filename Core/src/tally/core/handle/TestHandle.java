package tally.core.handle;

import tally.core.util.ObjectChecker;

/**
 * A read-only reference to a single test case, or to a collection-error placeholder, as handed over by the host test
 * framework.
 */
public final class TestHandle {
    private final String id;
    private final String shortDescription;
    private final TestKind kind;

    private TestHandle(String id, String shortDescription, TestKind kind) {
        ObjectChecker.assertNonNull(id, kind);
        this.id = id;
        this.shortDescription = shortDescription;
        this.kind = kind;
    }

    /**
     * @param id The stable identifier of the test.
     * @param shortDescription A human-readable description, or null if there is none.
     * @return a handle to an ordinary test.
     */
    public static TestHandle regular(String id, String shortDescription) {
        return new TestHandle(id, shortDescription, TestKind.REGULAR);
    }

    public static TestHandle documentationTest(String id, String shortDescription) {
        return new TestHandle(id, shortDescription, TestKind.DOCUMENTATION_TEST);
    }

    /**
     * @param label The label of the failing hook, conventionally {@code "<name> (<owner>)"}.
     * @return a placeholder handle for a failure outside any test.
     */
    public static TestHandle collectionError(String label) {
        return new TestHandle(label, null, TestKind.COLLECTION_ERROR);
    }

    public String id() {
        return this.id;
    }

    /**
     * @return the description, or null.
     */
    public String shortDescription() {
        return this.shortDescription;
    }

    public TestKind kind() {
        return this.kind;
    }

    @Override
    public String toString() {
        return this.getClass().getSimpleName() + " { id: " + this.id + ", description: " + this.shortDescription + ", kind: " + this.kind + " }";
    }
}
