package io.github.yok.evselink.core;

import com.google.common.util.concurrent.MoreExecutors;
import io.github.yok.evselink.catalog.EnumCatalog;
import io.github.yok.evselink.catalog.EnumCatalogLoader;
import io.github.yok.evselink.catalog.EnumCategory;
import io.github.yok.evselink.feed.EvseDataRecord;
import io.github.yok.evselink.feed.FeedRoot;
import io.github.yok.evselink.feed.OperatorEvseData;
import io.github.yok.evselink.model.Evse;
import io.github.yok.evselink.model.EvseEntry;
import io.github.yok.evselink.model.EvseTranslation;
import io.github.yok.evselink.model.Operator;
import io.github.yok.evselink.persistence.PersistenceOperation;
import io.github.yok.evselink.persistence.Tables;
import io.github.yok.evselink.persistence.TransactionalPlanExecutor;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.stream.Collectors;
import lombok.extern.slf4j.Slf4j;
import org.dbunit.database.IDatabaseConnection;

/**
 * Imports a feed into the destination database in two transactional phases.
 *
 * <p>
 * <strong>Operator phase</strong> (one transaction):
 * </p>
 * <ol>
 * <li>Delete all operators.</li>
 * <li>Insert-or-update the operators declared in the feed.</li>
 * </ol>
 *
 * <p>
 * <strong>Station phase</strong> (one transaction):
 * </p>
 * <ol>
 * <li>Delete all join rows, translation rows and EVSE rows (children first).</li>
 * <li>Insert-or-update the sub-operators derived from EVSE ids.</li>
 * <li>Insert-or-update the EVSE rows, attached to their corrected operators.</li>
 * <li>Insert-or-update the translation rows.</li>
 * <li>Insert-or-update the join rows of every category that resolved at least one row.</li>
 * </ol>
 *
 * <p>
 * Sub-operators precede EVSEs and EVSEs precede their dependent rows, so every foreign key
 * refers to a row written earlier in the same transaction. If the station phase fails, it is
 * rolled back as a whole; the committed operator phase is left as it is.
 * </p>
 *
 * <p>
 * All rows are derived in memory before the station transaction starts. Translation rows and
 * the join rows of each category depend only on the resolved EVSE entries and are derived
 * concurrently on the derivation executor; the plan is assembled once all of them completed.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
public class ImportOrchestrator {

    static final String OPERATOR_PHASE = "operator";
    static final String STATION_PHASE = "station";

    // Join tables in enum order; cleared in reverse
    static final List<EnumCategory> JOIN_CATEGORIES = Arrays.stream(EnumCategory.values())
            .filter(EnumCategory::hasJoinTable).collect(Collectors.toList());

    private final EnumCatalogLoader catalogLoader;
    private final OperatorResolver operatorResolver;
    private final EvseMapper evseMapper;
    private final LocalizationExtractor localizationExtractor;
    private final EnumRelationResolver enumRelationResolver;
    private final TransactionalPlanExecutor planExecutor;
    private final Executor derivationExecutor;

    /**
     * Creates an orchestrator that derives rows on the calling thread.
     *
     * @param catalogLoader enum catalog loader
     * @param localizationExtractor translation row extractor
     * @param planExecutor transactional plan executor
     */
    public ImportOrchestrator(EnumCatalogLoader catalogLoader,
            LocalizationExtractor localizationExtractor, TransactionalPlanExecutor planExecutor) {
        this(catalogLoader, new OperatorResolver(), new EvseMapper(), localizationExtractor,
                new EnumRelationResolver(), planExecutor, MoreExecutors.directExecutor());
    }

    /**
     * Creates an orchestrator.
     *
     * @param catalogLoader enum catalog loader
     * @param operatorResolver sub-operator resolver
     * @param evseMapper EVSE row mapper
     * @param localizationExtractor translation row extractor
     * @param enumRelationResolver join row resolver
     * @param planExecutor transactional plan executor
     * @param derivationExecutor executor for the independent derivation steps
     */
    public ImportOrchestrator(EnumCatalogLoader catalogLoader, OperatorResolver operatorResolver,
            EvseMapper evseMapper, LocalizationExtractor localizationExtractor,
            EnumRelationResolver enumRelationResolver, TransactionalPlanExecutor planExecutor,
            Executor derivationExecutor) {
        this.catalogLoader = catalogLoader;
        this.operatorResolver = operatorResolver;
        this.evseMapper = evseMapper;
        this.localizationExtractor = localizationExtractor;
        this.enumRelationResolver = enumRelationResolver;
        this.planExecutor = planExecutor;
        this.derivationExecutor = derivationExecutor;
    }

    /**
     * Runs both phases.
     *
     * @param feed parsed feed
     * @param dbConn DBUnit connection to the destination database
     * @return summary of the run
     * @throws ImportException if the catalog cannot be loaded or a phase fails
     */
    public ImportSummary execute(FeedRoot feed, IDatabaseConnection dbConn) {
        List<OperatorEvseData> blocks = feed.operatorBlocks();
        log.info("=== Import started (operators={}) ===", blocks.size());

        EnumCatalog catalog = loadCatalog(dbConn);
        ImportSummary summary = new ImportSummary();

        runOperatorPhase(blocks, dbConn, summary);
        runStationPhase(blocks, catalog, dbConn, summary);

        log.info("=== Import finished ===");
        summary.log();
        return summary;
    }

    /**
     * Replaces all operators with the ones declared in the feed.
     *
     * @param blocks operator blocks
     * @param dbConn DBUnit connection
     * @param summary summary to update
     */
    void runOperatorPhase(List<OperatorEvseData> blocks, IDatabaseConnection dbConn,
            ImportSummary summary) {
        List<Operator> operators = blocks.stream()
                .map(b -> new Operator(b.getOperatorId(), b.getOperatorName(), null))
                .collect(Collectors.toList());

        List<PersistenceOperation> plan = new ArrayList<>();
        plan.add(PersistenceOperation.clear(Tables.OPERATOR_TABLE));
        plan.add(PersistenceOperation.upsert(Tables.OPERATOR, operators));

        planExecutor.execute(OPERATOR_PHASE, dbConn, plan);
        summary.addWritten(Tables.OPERATOR_TABLE, operators.size());
    }

    /**
     * Replaces all EVSE data, including sub-operators, translations and join rows.
     *
     * @param blocks operator blocks
     * @param catalog catalog snapshot
     * @param dbConn DBUnit connection
     * @param summary summary to update
     */
    void runStationPhase(List<OperatorEvseData> blocks, EnumCatalog catalog,
            IDatabaseConnection dbConn, ImportSummary summary) {
        List<PersistenceOperation> plan = buildStationPlan(blocks, catalog, summary);
        planExecutor.execute(STATION_PHASE, dbConn, plan);
        plan.stream().filter(op -> op.getKind() == PersistenceOperation.Kind.UPSERT)
                .forEach(op -> summary.addWritten(op.getTableName(), op.rowCount()));
    }

    /**
     * Derives every row of the station phase and arranges the writes in dependency order.
     *
     * @param blocks operator blocks
     * @param catalog catalog snapshot
     * @param summary summary receiving unresolved option names
     * @return ordered plan
     * @throws MalformedEvseIdException if an EVSE id has no operator id
     */
    List<PersistenceOperation> buildStationPlan(List<OperatorEvseData> blocks,
            EnumCatalog catalog, ImportSummary summary) {
        OperatorResolution resolution = operatorResolver.resolve(toEntries(blocks));
        List<EvseEntry> entries = resolution.getEntries();
        List<Evse> evses = evseMapper.map(entries, catalog);

        CompletableFuture<List<EvseTranslation>> translations = CompletableFuture
                .supplyAsync(() -> localizationExtractor.extract(entries), derivationExecutor);
        Map<EnumCategory, CompletableFuture<EnumResolution>> relations =
                new EnumMap<>(EnumCategory.class);
        for (EnumCategory category : JOIN_CATEGORIES) {
            relations.put(category, CompletableFuture.supplyAsync(
                    () -> enumRelationResolver.resolve(category, entries, catalog),
                    derivationExecutor));
        }
        List<CompletableFuture<?>> all = new ArrayList<>(relations.values());
        all.add(translations);
        await(all);

        List<PersistenceOperation> plan = new ArrayList<>();
        List<EnumCategory> clearOrder = new ArrayList<>(JOIN_CATEGORIES);
        Collections.reverse(clearOrder);
        for (EnumCategory category : clearOrder) {
            plan.add(PersistenceOperation.clear(category.getJoinTable()));
        }
        plan.add(PersistenceOperation.clear(Tables.EVSE_TR_TABLE));
        plan.add(PersistenceOperation.clear(Tables.EVSE_TABLE));

        plan.add(PersistenceOperation.upsert(Tables.OPERATOR, resolution.getSubOperators()));
        plan.add(PersistenceOperation.upsert(Tables.EVSE, evses));
        plan.add(PersistenceOperation.upsert(Tables.EVSE_TR, translations.join()));

        for (EnumCategory category : JOIN_CATEGORIES) {
            EnumResolution result = relations.get(category).join();
            summary.addUnresolved(category.getJoinTable(), result.getUnresolved());
            if (result.isEmpty()) {
                log.info("Table[{}] no resolved rows → no write issued", category.getJoinTable());
                continue;
            }
            plan.add(PersistenceOperation.upsert(Tables.joinTable(category), result.getRows()));
        }
        log.debug("Station plan: {}", plan);
        return plan;
    }

    /**
     * Flattens the operator blocks into entries attached to their declaring operator.
     *
     * @param blocks operator blocks
     * @return entries in feed order
     */
    static List<EvseEntry> toEntries(List<OperatorEvseData> blocks) {
        List<EvseEntry> entries = new ArrayList<>();
        for (OperatorEvseData block : blocks) {
            if (block.getEvseDataRecords() == null) {
                continue;
            }
            for (EvseDataRecord record : block.getEvseDataRecords()) {
                if (record != null) {
                    entries.add(new EvseEntry(block.getOperatorId(), record));
                }
            }
        }
        return entries;
    }

    private EnumCatalog loadCatalog(IDatabaseConnection dbConn) {
        try {
            return catalogLoader.load(dbConn.getConnection());
        } catch (SQLException e) {
            throw new ImportException("Failed to load enum catalogs", e);
        }
    }

    private static void await(List<CompletableFuture<?>> futures) {
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture<?>[0])).join();
        } catch (CompletionException e) {
            Throwable cause = Objects.requireNonNullElse(e.getCause(), e);
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ImportException("Derivation failed: " + cause.getMessage(), cause);
        }
    }
}
