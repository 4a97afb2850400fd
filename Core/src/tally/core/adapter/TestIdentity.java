package tally.core.adapter;

import tally.core.handle.TestHandle;
import tally.core.handle.TestKind;

import java.util.regex.Pattern;

/**
 * Derives the string that correlates the start, outcome and finish events of one test.
 *
 * Identities are recomputed on every callback rather than stored, so the computation must stay a pure function of the
 * handle.
 */
public final class TestIdentity {
    private static final Pattern COLLECTION_ERROR_LABEL = Pattern.compile("^(.*) \\((.*)\\)$");

    /**
     * Returns the identity of the specified test.
     *
     * Documentation tests are always identified by their raw id. Any other test with a description that differs from
     * its id is identified as {@code "<id> (<description>)"}.
     *
     * @param test The test.
     * @return the identity.
     */
    public static String of(TestHandle test) {
        if (test.kind() != TestKind.DOCUMENTATION_TEST) {
            String description = test.shortDescription();
            if (description != null && !description.isEmpty() && !description.equals(test.id())) {
                return test.id() + " (" + description + ")";
            }
        }
        return test.id();
    }

    /**
     * Rewrites a collection-error label of the form {@code "setUpClass (com.example.FooTest)"} into the dotted form
     * {@code "com.example.FooTest.setUpClass"}. Labels of any other shape are returned unchanged.
     *
     * @param label The label.
     * @return the dotted name.
     */
    public static String fromCollectionErrorLabel(String label) {
        return COLLECTION_ERROR_LABEL.matcher(label).replaceFirst("$2.$1");
    }
}
