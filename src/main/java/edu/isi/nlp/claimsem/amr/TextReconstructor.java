package edu.isi.nlp.claimsem.amr;

import java.util.*;

/**
 * Rebuilds readable phrases for AMR nodes from their aligned tokens.
 *
 * AMR splits a phrase like "salt water" into a head node and a :mod child, so we glue the pieces
 * back together in a fixed order:
 * <pre>
 *   &lt;ARG1-of&gt; &lt;consist-of&gt; &lt;mod&gt;* &lt;focus&gt; &lt;op1&gt;
 * </pre>
 * and, for PropBank frames, "&lt;focus&gt; &lt;description of ARG1&gt;".
 */
public class TextReconstructor {
    private final AMR amr;
    private final Map<String, String> nodesToText;

    public TextReconstructor(AMR amr, Map<String, String> nodesToText) {
        this.amr = amr;
        this.nodesToText = nodesToText;
    }

    public TextReconstructor(AMR amr, List<AMRAlignment> alignments) {
        this(amr, AlignmentResolver.nodesToText(amr, alignments));
    }

    public AMR getAMR() {
        return amr;
    }

    /**
     * The aligned text for a node, or null if no token was aligned to it.
     */
    public String text(AMR.Node node) {
        return node == null ? null : nodesToText.get(node.ref);
    }

    public String describe(AMR.Node node) {
        return describe(node, false);
    }

    /**
     * @param ignoreFocusNode leave out the node's own tokens and keep only its modifiers; the node's
     *                        text is still returned if there is nothing else to say. PropBank frames
     *                        always lead with their own text
     */
    public String describe(AMR.Node node, boolean ignoreFocusNode) {
        return describe(node, ignoreFocusNode, new HashSet<>());
    }

    private String describe(AMR.Node focus, boolean ignoreFocusNode, Set<AMR.Node> visited) {
        visited.add(focus);
        List<String> parts = new ArrayList<>();
        String focusText = text(focus);

        if (AMRConstants.isPropBankFrame(focus.title)) {
            // Only ARG1; the other arguments drag in too much of the sentence
            AMR.Node arg1 = amr.getFirstChild(focus, ":ARG1");
            if (arg1 != null && !visited.contains(arg1)) {
                String argDescription = describe(arg1, false, visited);
                if (!argDescription.isEmpty()) {
                    parts.add(argDescription);
                }
            }
            // Frames always keep their own word; ignoring the focus only applies to modifiers
            if (focusText != null && !parts.contains(focusText)) {
                parts.add(0, focusText);
            }
        } else {
            for (AMR.Node mod : amr.getChildren(focus, ":mod")) {
                String modText = text(mod);
                if (modText != null) parts.add(0, modText);
            }
            prependFirst(focus, ":consist-of", parts);
            prependFirst(focus, ":ARG1-of", parts);

            AMR.Node op1 = amr.getFirstChild(focus, ":op1");
            if (op1 != null && parts.isEmpty()) {
                if (!ignoreFocusNode && focusText != null) {
                    parts.add(focusText);
                }
                String opText = text(op1);
                if (opText != null) parts.add(opText);
            } else if (!ignoreFocusNode && focusText != null && !parts.contains(focusText)) {
                parts.add(focusText);
            }
        }

        if (parts.isEmpty() && ignoreFocusNode && focusText != null) {
            return focusText;
        }
        return String.join(" ", parts);
    }

    private void prependFirst(AMR.Node focus, String role, List<String> parts) {
        String firstText = text(amr.getFirstChild(focus, role));
        if (firstText != null && !parts.contains(firstText)) {
            parts.add(0, firstText);
        }
    }

    /**
     * The text of the node's :name children, or null if it has none with aligned text.
     */
    public String fullName(AMR.Node node) {
        List<String> names = new ArrayList<>();
        for (AMR.Node name : amr.getChildren(node, ":name")) {
            String nameText = text(name);
            if (nameText != null) names.add(nameText);
        }
        return names.isEmpty() ? null : String.join(" ", names);
    }

    /**
     * The full name if there is one, otherwise the full description.
     */
    public String nameOrDescription(AMR.Node node) {
        String name = fullName(node);
        return name != null ? name : describe(node);
    }
}
