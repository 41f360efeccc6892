package com.raditha.cocotb.pass;

import com.raditha.cocotb.config.MigrationSettings;
import com.raditha.cocotb.match.NameTable;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Builds the pass list for a run from the configured rule tables.
 *
 * <p>
 * With an empty {@code passes} setting every pass runs, ordered by
 * {@link TransformationPass#getPriority()}. That order is chosen so that no pass produces input
 * for a pass that ran before it. An explicit list selects passes by name and runs them in the
 * listed order.
 */
public final class PassCatalogue {

    private PassCatalogue() {
        // Utility class
    }

    /**
     * Every available pass, in default order.
     */
    public static List<TransformationPass> all(MigrationSettings settings) {
        Set<String> asyncMarkers = new LinkedHashSet<>(settings.getCoroutineMarkers());
        asyncMarkers.addAll(settings.getTestMarkers());

        List<TransformationPass> passes = new ArrayList<>();
        passes.add(new CoroutineDecoratorPass(Set.copyOf(settings.getCoroutineMarkers())));
        passes.add(new AsyncTestFunctionPass(Set.copyOf(settings.getTestMarkers())));
        passes.add(new YieldToAwaitPass(asyncMarkers));
        passes.add(new ReturnValuePass(Set.copyOf(settings.getReturnValueNames())));
        passes.add(new CallRenamePass(NameTable.of(settings.getCallRenames())));
        passes.add(new StartSoonUnwrapPass(Set.copyOf(settings.getStartSoonSchedulers()), settings.getStartMethod()));
        passes.add(new KeywordRenamePass(NameTable.of(settings.getKeywordRenames())));
        passes.add(new KeywordRemovalPass(NameTable.of(settings.getKeywordRemovals()),
                settings.getKeywordRemovalAdvisories()));
        passes.add(new ValueAccessorPass());
        passes.add(new AttributeRemovalPass(settings.getRemovedAttributes()));
        passes.add(new QualifyNamesPass(settings.getQualifiedNames()));
        passes.sort(Comparator.comparingInt(TransformationPass::getPriority));
        return passes;
    }

    /**
     * The passes selected by {@link MigrationSettings#getPasses()}.
     *
     * @throws IllegalArgumentException when a configured name is not a known pass
     */
    public static List<TransformationPass> build(MigrationSettings settings) {
        List<TransformationPass> available = all(settings);
        if (settings.getPasses().isEmpty()) {
            return available;
        }
        Map<String, TransformationPass> byName = new LinkedHashMap<>();
        for (TransformationPass pass : available) {
            byName.put(pass.getName(), pass);
        }
        List<TransformationPass> selected = new ArrayList<>();
        for (String name : settings.getPasses()) {
            TransformationPass pass = byName.get(name);
            if (pass == null) {
                throw new IllegalArgumentException("Unknown pass '" + name + "'; known passes: " + byName.keySet());
            }
            selected.add(pass);
        }
        return selected;
    }

    public static List<String> names(MigrationSettings settings) {
        return all(settings).stream().map(TransformationPass::getName).toList();
    }
}
