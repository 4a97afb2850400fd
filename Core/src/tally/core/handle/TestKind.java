package tally.core.handle;

/**
 * What a {@link TestHandle} refers to.
 */
public enum TestKind {
    /**
     * An ordinary test case.
     */
    REGULAR,

    /**
     * A test extracted from documentation. Its identity never carries a description suffix.
     */
    DOCUMENTATION_TEST,

    /**
     * A placeholder standing in for a failure that happened outside any test body, such as a failing class-level
     * setup hook. Its id is a free-form label of the shape {@code "<name> (<owner>)"}.
     */
    COLLECTION_ERROR
}
