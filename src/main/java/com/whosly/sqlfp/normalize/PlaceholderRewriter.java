package com.whosly.sqlfp.normalize;

import com.whosly.sqlfp.tree.Literal;
import com.whosly.sqlfp.tree.Placeholder;
import com.whosly.sqlfp.tree.SqlNode;
import com.whosly.sqlfp.tree.Statement;
import com.whosly.sqlfp.tree.TreeRewriter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Replaces every literal with the caller's placeholder and records the
 * literal's text.
 *
 * The traversal order of {@link TreeRewriter} is the renderer's output
 * order, so the i-th recorded parameter belongs to the i-th placeholder in
 * the rendered text. Instances hold per-call state and must not be shared.
 */
public class PlaceholderRewriter extends TreeRewriter {

    private final String placeholder;
    private final List<String> params = new ArrayList<>();

    public PlaceholderRewriter(String placeholder) {
        this.placeholder = Objects.requireNonNull(placeholder, "placeholder");
    }

    public Statement substitute(Statement statement) {
        return rewrite(statement, Statement.class);
    }

    @Override
    public SqlNode visitLiteral(Literal node) {
        if (!LiteralClassifier.isLiteral(node)) {
            return node;
        }
        params.add(node.getText());
        return new Placeholder(placeholder);
    }

    /**
     * @return the extracted literal texts in placeholder order
     */
    public List<String> getParams() {
        return Collections.unmodifiableList(params);
    }
}
