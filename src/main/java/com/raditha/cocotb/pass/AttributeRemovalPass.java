package com.raditha.cocotb.pass;

import com.raditha.cocotb.cst.NodeKind;
import com.raditha.cocotb.cst.Nodes;
import com.raditha.cocotb.cst.SyntaxNode;
import com.raditha.cocotb.match.Matcher;
import com.raditha.cocotb.match.Pattern;
import com.raditha.cocotb.match.Patterns;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Reports accesses to attributes that were removed without replacement, such as
 * {@code Clock.frequency}. The tree is not changed here; every access gets a manual review
 * diagnostic, and each removed attribute that was seen at least once gets one advisory comment
 * at the top of the file.
 */
public class AttributeRemovalPass extends TransformationPass {
    public static final String NAME = "attribute-removal";

    private final Map<String, String> advisories;
    private final Pattern removedAttribute;

    /**
     * @param advisories removed attribute name to the comment inserted when it is found
     */
    public AttributeRemovalPass(Map<String, String> advisories) {
        this.advisories = new LinkedHashMap<>(advisories);
        this.removedAttribute = Patterns.anyOf(advisories.keySet().stream()
                .sorted()
                .map(Patterns::attributeNamed)
                .toArray(Pattern[]::new));
    }

    @Override
    public String getName() {
        return NAME;
    }

    @Override
    public int getPriority() {
        return 90;
    }

    @Override
    public String getDescription() {
        return "Clock.frequency and other removed attributes -> review warning and advisory comment";
    }

    @Override
    public Set<NodeKind> inspectedKinds() {
        return Set.of(NodeKind.ATTRIBUTE);
    }

    @Override
    public boolean wouldTouch(SyntaxNode node, PassContext context) {
        return Matcher.matches(node, removedAttribute);
    }

    @Override
    public SyntaxNode rewrite(SyntaxNode attribute, PassContext context) {
        if (wouldTouch(attribute, context)) {
            String name = Nodes.attributeName(attribute);
            context.markSeen(name);
            context.manualReview("'" + attribute.toSource().strip() + "': attribute '" + name
                    + "' was removed and has no replacement", attribute.line());
        }
        return attribute;
    }

    @Override
    public SyntaxNode finish(SyntaxNode module, PassContext context) {
        for (String name : context.seen()) {
            context.requestAdvisory(advisories.get(name));
        }
        return module;
    }
}
