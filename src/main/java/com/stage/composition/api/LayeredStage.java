package com.stage.composition.api;

import com.stage.composition.cache.CaffeineLayerParseCache;
import com.stage.composition.cache.LayerParseCache;
import com.stage.composition.changelog.ChangeLedger;
import com.stage.composition.changelog.ChangeLogParser;
import com.stage.composition.changelog.ChangeLogWriter;
import com.stage.composition.changelog.CommitHistory;
import com.stage.composition.changelog.PathTranslationRegistry;
import com.stage.composition.compose.PrimComposer;
import com.stage.composition.config.StageOptions;
import com.stage.composition.conflict.Conflict;
import com.stage.composition.conflict.ConflictDetector;
import com.stage.composition.conflict.PermissionChecker;
import com.stage.composition.conflict.PermissionDecision;
import com.stage.composition.core.MalformedSourceException;
import com.stage.composition.core.ValidationException;
import com.stage.composition.core.model.CommitEntry;
import com.stage.composition.core.model.Layer;
import com.stage.composition.core.model.LayerStatus;
import com.stage.composition.core.model.Prim;
import com.stage.composition.core.model.PrimTree;
import com.stage.composition.core.model.Provenance;
import com.stage.composition.edit.EditResult;
import com.stage.composition.edit.RenameResult;
import com.stage.composition.edit.SurgicalEditor;
import com.stage.composition.export.StageJsonExporter;
import com.stage.composition.layer.LayerStack;
import com.stage.composition.logging.LogContext;
import com.stage.composition.merge.LayerMerger;
import com.stage.composition.parse.PrimParser;
import com.stage.composition.resolve.ReferenceResolver;
import com.stage.composition.resolve.ResolutionResult;
import com.stage.composition.resolve.Stage;
import com.stage.composition.resolve.StageComposer;
import com.stage.composition.security.StageContext;
import com.stage.composition.split.LayerSplitter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry point for composing and editing a layered stage.
 *
 * <p>Owns one {@link Stage}. Edits are applied to the layer text in the stage, then the
 * staged prims coming from that layer are refreshed. Commits, promotions and renames are
 * recorded in the ledger and appended to the change-log layer.</p>
 *
 * <pre>
 * LayeredStage stage = LayeredStage.builder()
 *     .options(StageOptions.defaults())
 *     .build();
 *
 * stage.load("building.usda", text, LayerStatus.PUBLISHED, null);
 * stage.stageFromStack();
 * ResolutionResult composed = stage.compose(StageContext.of("alice", ActorRole.ARCHITECT));
 * </pre>
 */
public class LayeredStage {
    private static final Logger log = LoggerFactory.getLogger(LayeredStage.class);

    private final StageOptions options;
    private final Stage stage;
    private final PrimParser parser;
    private final PrimComposer composer;
    private final SurgicalEditor editor;
    private final LayerMerger merger;
    private final StageComposer stageComposer;
    private final ConflictDetector conflictDetector;
    private final PermissionChecker permissionChecker;
    private final ChangeLogWriter changeLogWriter;
    private final ChangeLogParser changeLogParser;
    private final LayerSplitter splitter;
    private final StageJsonExporter exporter;
    private final LayerParseCache cache;
    private final Clock clock;
    private ChangeLedger ledger;

    private LayeredStage(Builder builder) {
        this.options = builder.options;
        this.clock = builder.clock;
        this.stage = new Stage(builder.layerStack != null ? builder.layerStack : new LayerStack());
        this.cache = builder.cache != null ? builder.cache : CaffeineLayerParseCache.create(options.getCacheConfig());

        String indent = options.getIndentUnit();
        this.parser = new PrimParser(options.getNamespace());
        this.composer = new PrimComposer(indent, options.getDefaultStatus());
        this.editor = new SurgicalEditor(parser, options.getNamespace(), indent);
        ReferenceResolver resolver = new ReferenceResolver(parser, cache, options.getDefaultStatus());
        this.merger = new LayerMerger(parser);
        this.stageComposer = new StageComposer(parser, merger, resolver, options.getChangelogLayer());
        this.conflictDetector = new ConflictDetector(parser, options.getChangelogLayer());
        this.permissionChecker = new PermissionChecker();
        this.changeLogWriter = new ChangeLogWriter(composer, editor, parser, options.getChangelogRoot());
        this.changeLogParser = new ChangeLogParser(parser);
        this.splitter = new LayerSplitter(parser, composer, indent);
        this.exporter = new StageJsonExporter();
        this.ledger = new ChangeLedger(clock);

        log.info("stage.initialized changelogLayer={} namespace={} defaultStatus={}",
                options.getChangelogLayer(), options.getNamespace(), options.getDefaultStatus().token());
    }

    // ========== Layers ==========

    /**
     * Loads a layer text. The change-log layer is kept out of the stack and seeds the ledger;
     * any other file is added to the stack if it is not there yet.
     *
     * @return the layer, or empty for the change-log layer
     */
    public Optional<Layer> load(String filePath, String text, LayerStatus status, String owner) {
        stage.putText(filePath, text);
        if (filePath.equals(options.getChangelogLayer())) {
            ledger = ChangeLedger.continuing(history(), clock);
            log.info("stage.changelog.loaded entries={}", ledger.size());
            return Optional.empty();
        }
        LayerStack stack = stage.getLayerStack();
        Layer layer = stack.find(filePath).orElseGet(() -> stack.add(LayerStack.createLayer(filePath, status)));
        if (owner != null) {
            stack.setOwner(filePath, owner);
        }
        return Optional.of(layer);
    }

    public Optional<Layer> load(String filePath, String text) {
        return load(filePath, text, LayerStatus.DRAFT, null);
    }

    /**
     * Splits a document into atomic layers and loads each of them.
     */
    public List<Layer> loadSplit(String fileName, String text, LayerStatus status, String owner) {
        List<Layer> layers = new ArrayList<>();
        for (Map.Entry<String, String> file : splitter.split(text, fileName).entrySet()) {
            load(file.getKey(), file.getValue(), status, owner).ifPresent(layers::add);
        }
        return layers;
    }

    public void unload(String filePath) {
        stage.getLayerStack().remove(filePath);
        stage.removeText(filePath);
    }

    /**
     * Promotes a layer one status step and records the promotion.
     */
    public LayerStatus promote(String filePath, StageContext context) {
        LayerStatus from = stage.getLayerStack().get(filePath).getStatus();
        LayerStatus to = stage.getLayerStack().promote(filePath);
        if (from != to) {
            String text = stage.getText(filePath).orElse("");
            appendToChangeLog(ledger.recordPromotion(context, filePath, text, layerPaths(text), from, to, null));
        }
        return to;
    }

    public LayerStatus demote(String filePath, StageContext context) {
        LayerStatus from = stage.getLayerStack().get(filePath).getStatus();
        LayerStatus to = stage.getLayerStack().demote(filePath);
        if (from != to) {
            String text = stage.getText(filePath).orElse("");
            appendToChangeLog(ledger.recordPromotion(context, filePath, text, layerPaths(text), from, to, null));
        }
        return to;
    }

    // ========== Staging and composition ==========

    /**
     * Rebuilds the staged prims from every visible layer.
     *
     * @return warnings for layers that could not be staged
     */
    public List<String> stageFromStack() {
        return stageComposer.stageFromStack(stage);
    }

    /**
     * Stages prims of one layer and records the commit.
     *
     * @throws ValidationException if the layer is not loaded or a path is not in it
     */
    public CommitEntry stagePrims(String filePath, List<String> primPaths, StageContext context) {
        String text = stage.getText(filePath)
                .orElseThrow(() -> new ValidationException("Layer not loaded: " + filePath, "filePath", filePath));
        List<Prim> roots = parser.parse(text).roots();
        LayerStatus status = stage.getLayerStack().find(filePath)
                .map(Layer::getStatus)
                .orElse(options.getDefaultStatus());

        List<Prim> picked = new ArrayList<>();
        List<String> stagedPaths = new ArrayList<>();
        String entityType = null;
        for (String path : primPaths) {
            Prim prim = PrimTree.findByPath(roots, path)
                    .orElseThrow(() -> new ValidationException("Prim not found: " + path, "primPath", path))
                    .deepCopy();
            PrimTree.walk(List.of(prim), p -> {
                p.setProvenance(Provenance.of(filePath, p.getPath(), status));
                stagedPaths.add(p.getPath());
            });
            if (entityType == null) {
                entityType = prim.getPropertyText("entityType").orElse(prim.getType());
            }
            picked.add(prim);
        }
        stage.setStagedPrims(merger.merge(stage.getStagedPrims(), picked));

        CommitEntry entry = ledger.recordCommit(context, filePath, text,
                primPaths.isEmpty() ? null : primPaths.get(0), stagedPaths, status, entityType);
        appendToChangeLog(entry);
        return entry;
    }

    public ResolutionResult compose(StageContext context) {
        try (LogContext ignored = LogContext.forResolve(LogContext.generateCorrelationId())
                .with("identity", context.identity())) {
            return stageComposer.compose(stage, context);
        }
    }

    public ResolutionResult refresh(String filePath, String primPath, StageContext context) {
        try (LogContext ignored = LogContext.forRefresh(LogContext.generateCorrelationId(), filePath)) {
            return stageComposer.refresh(stage, filePath, primPath, context);
        }
    }

    /**
     * The composed tree as a stage document wrapped in an assembly named after the scene.
     */
    public String composeStageDocument(String sceneName, StageContext context) {
        return composer.composeStage(sceneName, compose(context).roots());
    }

    public String exportJson(StageContext context) {
        return exporter.export(compose(context).roots());
    }

    // ========== Edits ==========

    /**
     * Sets a property on a prim in a layer. Denied edits leave the text unchanged and carry the
     * denial reason as warning.
     */
    public EditResult updateProperty(String filePath, String primPath, String name, String value, String type,
                                     StageContext context) {
        String text = textOf(filePath);
        Optional<PermissionDecision> denied = denial(filePath, primPath, context);
        if (denied.isPresent()) {
            return EditResult.unchanged(text, denied.get().reason());
        }
        try (LogContext ignored = LogContext.forEdit(LogContext.generateCorrelationId(), filePath, primPath)
                .with("property", name)) {
            EditResult result = editor.updateProperty(text, primPath, name, value, type);
            apply(filePath, result.isApplied(), result.text(), primPath, context);
            return result;
        }
    }

    public EditResult updateProperty(String filePath, String primPath, String name, String value,
                                     StageContext context) {
        return updateProperty(filePath, primPath, name, value, "string", context);
    }

    /**
     * Writes a prim block under the given parent path of a layer.
     */
    public EditResult insertPrim(String filePath, String parentPath, Prim prim, StageContext context) {
        String text = stage.getText(filePath).orElse("");
        Optional<PermissionDecision> denied = denial(filePath, prim.getPath(), context);
        if (denied.isPresent()) {
            return EditResult.unchanged(text, denied.get().reason());
        }
        LayerStatus status = stage.getLayerStack().find(filePath).map(Layer::getStatus).orElse(null);
        try (LogContext ignored = LogContext.forEdit(LogContext.generateCorrelationId(), filePath, prim.getPath())) {
            EditResult result = editor.insert(text, parentPath, composer.compose(prim, 0, status));
            apply(filePath, result.isApplied(), result.text(), null, context);
            return result;
        }
    }

    public EditResult removePrim(String filePath, String primPath, StageContext context) {
        String text = textOf(filePath);
        Optional<PermissionDecision> denied = denial(filePath, primPath, context);
        if (denied.isPresent()) {
            return EditResult.unchanged(text, denied.get().reason());
        }
        try (LogContext ignored = LogContext.forEdit(LogContext.generateCorrelationId(), filePath, primPath)) {
            EditResult result = editor.remove(text, primPath);
            apply(filePath, result.isApplied(), result.text(), null, context);
            return result;
        }
    }

    /**
     * Renames a prim and records the rename.
     *
     * @throws ValidationException if the new name is not a valid identifier
     */
    public RenameResult renamePrim(String filePath, String primPath, String newName, StageContext context) {
        String text = textOf(filePath);
        Optional<PermissionDecision> denied = denial(filePath, primPath, context);
        if (denied.isPresent()) {
            return RenameResult.unchanged(text, primPath, denied.get().reason());
        }
        try (LogContext ignored = LogContext.forEdit(LogContext.generateCorrelationId(), filePath, primPath)) {
            RenameResult result = editor.rename(text, primPath, newName);
            if (result.isRenamed()) {
                stage.putText(filePath, result.text());
                renameStaged(filePath, primPath, result.newPath());
                appendToChangeLog(ledger.recordRename(context, filePath, result.text(), primPath, result.newPath()));
            }
            return result;
        }
    }

    // ========== Conflicts and permissions ==========

    public List<Conflict> detectConflicts(Prim prim, String propertyName, String candidateValue,
                                          StageContext context) {
        return conflictDetector.detect(prim, propertyName, candidateValue, stage, context);
    }

    public PermissionDecision checkPermission(Prim prim, boolean historyMode, StageContext context) {
        return permissionChecker.checkPermission(prim, historyMode, stage.getLayerStack(), context);
    }

    // ========== History ==========

    /**
     * Commit history as currently written in the change-log layer.
     */
    public CommitHistory history() {
        return changeLogParser.parse(stage.getText(options.getChangelogLayer()).orElse(""));
    }

    public PathTranslationRegistry pathRegistry() {
        return PathTranslationRegistry.build(history());
    }

    // ========== Accessors ==========

    public Stage getStage() {
        return stage;
    }

    public LayerStack getLayerStack() {
        return stage.getLayerStack();
    }

    public StageOptions getOptions() {
        return options;
    }

    public ChangeLedger getLedger() {
        return ledger;
    }

    public LayerParseCache getCache() {
        return cache;
    }

    private String textOf(String filePath) {
        return stage.getText(filePath)
                .orElseThrow(() -> new ValidationException("Layer not loaded: " + filePath, "filePath", filePath));
    }

    /**
     * Permission denial for editing a prim of the given layer, if any. Ownership of the edited
     * layer decides, whether or not the prim is visible to the actor.
     */
    private Optional<PermissionDecision> denial(String filePath, String primPath, StageContext context) {
        LayerStatus status = stage.getLayerStack().find(filePath).map(Layer::getStatus).orElse(null);
        Prim subject = Prim.builder()
                .path(primPath)
                .provenance(Provenance.of(filePath, primPath, status))
                .build();
        return Optional.of(checkPermission(subject, false, context))
                .filter(PermissionDecision::isDenied);
    }

    private void apply(String filePath, boolean applied, String newText, String primPath, StageContext context) {
        if (!applied) {
            return;
        }
        stage.putText(filePath, newText);
        if (isStagedFrom(filePath)) {
            try {
                stageComposer.refresh(stage, filePath, primPath, context);
            } catch (MalformedSourceException e) {
                log.warn("stage.refresh.skipped filePath={} reason=\"{}\"", filePath, e.getMessage());
            }
        }
    }

    private void renameStaged(String filePath, String oldPath, String newPath) {
        List<Prim> staged = PrimTree.deepCopy(stage.getStagedPrims());
        Optional<Prim> renamed = replaceRenamed(staged, oldPath, newPath);
        if (renamed.isEmpty()) {
            return;
        }
        PrimTree.walk(List.of(renamed.get()), p -> p.getProvenance()
                .filter(prov -> prov.sourceFile().equals(filePath))
                .ifPresent(prov -> p.setProvenance(Provenance.of(filePath, p.getPath(), prov.sourceLayerStatus()))));
        stage.setStagedPrims(staged);
        log.debug("stage.staged.renamed from={} to={}", oldPath, newPath);
    }

    private static Optional<Prim> replaceRenamed(List<Prim> siblings, String oldPath, String newPath) {
        for (int i = 0; i < siblings.size(); i++) {
            Prim prim = siblings.get(i);
            if (prim.getPath().equals(oldPath)) {
                Prim rebased = prim.rebase(newPath);
                siblings.set(i, rebased);
                return Optional.of(rebased);
            }
            if (oldPath.startsWith(prim.getPath() + "/")) {
                Optional<Prim> found = replaceRenamed(prim.getChildren(), oldPath, newPath);
                if (found.isPresent()) {
                    return found;
                }
            }
        }
        return Optional.empty();
    }

    private boolean isStagedFrom(String filePath) {
        boolean[] found = {false};
        PrimTree.walk(stage.getStagedPrims(), p -> p.getProvenance()
                .map(Provenance::sourceFile)
                .filter(filePath::equals)
                .ifPresent(f -> found[0] = true));
        return found[0];
    }

    private List<String> layerPaths(String text) {
        try {
            return parser.parse(text).paths();
        } catch (MalformedSourceException e) {
            return List.of();
        }
    }

    private void appendToChangeLog(CommitEntry entry) {
        String changelog = options.getChangelogLayer();
        EditResult result = changeLogWriter.append(stage.getText(changelog).orElse(""), entry);
        if (result.isApplied()) {
            stage.putText(changelog, result.text());
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private StageOptions options = StageOptions.defaults();
        private LayerStack layerStack;
        private LayerParseCache cache;
        private Clock clock = Clock.systemUTC();

        public Builder options(StageOptions options) {
            this.options = options;
            return this;
        }

        /**
         * Starts from an existing layer stack instead of an empty one.
         */
        public Builder layerStack(LayerStack layerStack) {
            this.layerStack = layerStack;
            return this;
        }

        /**
         * Sets a custom parse cache. Defaults to the one described by the options.
         */
        public Builder cache(LayerParseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public LayeredStage build() {
            if (options == null) {
                throw new IllegalStateException("StageOptions are required");
            }
            return new LayeredStage(this);
        }
    }
}
