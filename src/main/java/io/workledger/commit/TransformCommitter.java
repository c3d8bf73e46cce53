package io.workledger.commit;

import io.workledger.error.InvalidArgumentException;
import io.workledger.model.CollectionLineage;
import io.workledger.model.NewCollection;
import io.workledger.model.NewTransform;
import io.workledger.storage.CollectionStore;
import io.workledger.storage.Database;
import io.workledger.storage.RequestStore;
import io.workledger.storage.TransformStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

/**
 * Materializes the Transforms a worker derived from a Request and records the Request's new state,
 * all in one transaction.
 *
 * <p>Output collections get lineage metadata pointing at the transform, its workload and the ids of
 * the input and log collections created alongside them.
 */
public final class TransformCommitter {
    private static final Logger log = LoggerFactory.getLogger(TransformCommitter.class);

    private final Database database;
    private final RequestStore requests;
    private final TransformStore transforms;
    private final CollectionStore collections;

    public TransformCommitter(Database database, RequestStore requests, TransformStore transforms,
                              CollectionStore collections) {
        this.database = database;
        this.requests = requests;
        this.transforms = transforms;
        this.collections = collections;
    }

    public CommitOutcome commit(CommitRequest request) {
        for (TransformSpec spec : request.transformsToAdd()) {
            if (spec.collections() == null || spec.collections().isEmpty()) {
                throw new InvalidArgumentException(
                        "Transform must have collections, such as input collection, output collection and log collection");
            }
        }
        for (TransformExtension extension : request.transformsToExtend()) {
            if (extension.update() == null || extension.update().isEmpty()) {
                throw new InvalidArgumentException("Transform " + extension.transformId() + " extension has no fields");
            }
        }
        CommitOutcome outcome = database.inTransaction("transform commit", c -> {
            List<CommitOutcome.AddedTransform> added = new ArrayList<>();
            for (TransformSpec spec : request.transformsToAdd()) {
                added.add(addTransform(c, spec));
            }
            List<Long> extended = new ArrayList<>();
            for (TransformExtension extension : request.transformsToExtend()) {
                transforms.update(c, extension.transformId(), extension.update());
                extended.add(extension.transformId());
            }
            updateRequest(c, request);
            return new CommitOutcome(request.requestId(), List.copyOf(added), List.copyOf(extended));
        });
        log.info("Committed request {}: {} transforms added, {} extended",
                request.requestId(), outcome.addedTransforms().size(), outcome.extendedTransforms().size());
        return outcome;
    }

    private CommitOutcome.AddedTransform addTransform(Connection c, TransformSpec spec) throws SQLException {
        NewTransform transform = spec.toNewTransform();
        long transformId = transforms.add(c, transform);
        List<Long> inputIds = new ArrayList<>();
        for (NewCollection input : spec.collections().inputCollections()) {
            inputIds.add(collections.add(c, transformId, input));
        }
        List<Long> logIds = new ArrayList<>();
        for (NewCollection logColl : spec.collections().logCollections()) {
            logIds.add(collections.add(c, transformId, logColl));
        }
        CollectionLineage lineage = new CollectionLineage(transformId, transform.workloadId(), inputIds, logIds);
        List<Long> outputIds = new ArrayList<>();
        for (NewCollection output : spec.collections().outputCollections()) {
            outputIds.add(collections.add(c, transformId, output.withMetadata(lineage.mergeInto(output.collMetadata()))));
        }
        return new CommitOutcome.AddedTransform(transformId, inputIds, outputIds, logIds);
    }

    private void updateRequest(Connection c, CommitRequest request) throws SQLException {
        if (request.leaseEpoch() != null) {
            requests.updateUnderLease(c, request.requestId(), request.leaseEpoch(), request.requestParameters());
        } else if (request.requestParameters() != null && !request.requestParameters().isEmpty()) {
            requests.update(c, request.requestId(), request.requestParameters());
        } else {
            requests.get(c, request.requestId());
        }
    }
}
