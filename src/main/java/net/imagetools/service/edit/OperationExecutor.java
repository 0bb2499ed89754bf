package net.imagetools.service.edit;

import io.github.resilience4j.timelimiter.TimeLimiter;
import io.micrometer.core.instrument.Timer;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeoutException;
import lombok.extern.slf4j.Slf4j;
import net.imagetools.config.EditProperties;
import net.imagetools.domain.operation.AiEditOperation;
import net.imagetools.domain.operation.AiEditStep;
import net.imagetools.domain.operation.CompressOperation;
import net.imagetools.domain.operation.FlipOperation;
import net.imagetools.domain.operation.ImageOperation;
import net.imagetools.domain.operation.RemoveBackgroundOperation;
import net.imagetools.domain.operation.ResizeOperation;
import net.imagetools.domain.operation.RotateOperation;
import net.imagetools.exception.ImageToolsException;
import net.imagetools.exception.StorageException;
import net.imagetools.exception.TransformException;
import net.imagetools.exception.ValidationException;
import net.imagetools.model.Image;
import net.imagetools.model.PixelData;
import net.imagetools.model.Revision;
import net.imagetools.service.EditMetrics;
import net.imagetools.service.storage.RevisionStore;
import net.imagetools.service.transform.PixelTransformer;
import net.imagetools.support.retry.TransformRetrySupport;
import net.imagetools.util.LoggingUtils;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.stereotype.Service;

/**
 * Turns an operation on an image into a stored revision and thumbnail.
 *
 * <p>The executor never touches history or the image record: callers append the returned
 * {@link AppliedOperation} and swap pointers themselves. Validation runs before any read,
 * and every retry happens before anything is written.</p>
 */
@Slf4j
@Service
public class OperationExecutor {

    private final PixelTransformer transformer;
    private final RevisionStore revisionStore;
    private final CompressionProfileCatalog profileCatalog;
    private final AsyncTaskExecutor transformExecutor;
    private final TimeLimiter timeLimiter;
    private final EditProperties editProperties;
    private final EditMetrics metrics;

    public OperationExecutor(PixelTransformer transformer,
                             RevisionStore revisionStore,
                             CompressionProfileCatalog profileCatalog,
                             @Qualifier("transformExecutor") AsyncTaskExecutor transformExecutor,
                             TimeLimiter transformTimeLimiter,
                             EditProperties editProperties,
                             EditMetrics metrics) {
        this.transformer = transformer;
        this.revisionStore = revisionStore;
        this.profileCatalog = profileCatalog;
        this.transformExecutor = transformExecutor;
        this.timeLimiter = transformTimeLimiter;
        this.editProperties = editProperties;
        this.metrics = metrics;
    }

    /**
     * Validates and normalizes an operation without running it: defaults are filled in
     * and compression profiles are snapshotted into the operation.
     *
     * @throws ValidationException when a parameter is out of range or names something unknown
     */
    public ImageOperation resolve(ImageOperation operation) {
        if (operation == null) {
            throw new ValidationException("operation", "Operation is required");
        }
        return operation.accept(new OperationResolver());
    }

    public AppliedOperation apply(Image image, ImageOperation operation) {
        ImageOperation recorded = resolve(operation);
        PixelData source = new PixelData(revisionStore.getBytes(image.currentRevision()),
            image.format(), image.width(), image.height());

        TransformRetrySupport.RetryConfig retryConfig = TransformRetrySupport.RetryConfig.of(
            log, editProperties.getTransformMaxAttempts(), editProperties.getTransformBackoff());
        String label = recorded.kind().wireName() + " on image " + image.id();
        PixelData result = TransformRetrySupport.execute(retryConfig, label, () -> transform(recorded, source));

        StoredRevision stored = store(image.id(), result);
        log.info("Applied {} to image {}: {}x{} -> {}x{} ({} bytes, token {})",
            recorded.kind().wireName(), image.id(), image.width(), image.height(),
            result.width(), result.height(), result.size(), stored.revision().versionToken());
        return new AppliedOperation(stored.revision(), stored.thumbnail(), recorded);
    }

    /**
     * Writes a revision and its thumbnail. When the thumbnail cannot be written the revision
     * is deleted again so no half-stored pair is left behind.
     */
    public StoredRevision store(String imageId, PixelData data) {
        Revision revision = revisionStore.put(imageId, data);
        try {
            return new StoredRevision(revision, revisionStore.thumbnail(imageId, revision));
        } catch (RuntimeException thumbnailFailure) {
            discard(revision, thumbnailFailure);
            if (thumbnailFailure instanceof StorageException storageException) {
                throw storageException;
            }
            throw new StorageException("Failed to store thumbnail of " + revision.key() + ": "
                + thumbnailFailure.getMessage(), revision.key(), thumbnailFailure);
        }
    }

    private PixelData transform(ImageOperation operation, PixelData source) {
        Timer.Sample sample = metrics.startTransform();
        boolean success = false;
        try {
            PixelData result = runWithTimeout(operation, () -> operation.accept(new TransformDispatcher(source)));
            success = true;
            return result;
        } finally {
            metrics.transformFinished(sample, operation.kind(), success);
        }
    }

    private PixelData runWithTimeout(ImageOperation operation, Callable<PixelData> work) {
        try {
            return timeLimiter.executeFutureSupplier(() -> transformExecutor.submit(work));
        } catch (ImageToolsException e) {
            throw e;
        } catch (TimeoutException e) {
            throw new TransformException(operation.kind(),
                "timed out after " + timeLimiter.getTimeLimiterConfig().getTimeoutDuration().toMillis() + "ms", true, e);
        } catch (RejectedExecutionException e) {
            throw new TransformException(operation.kind(), "transform pool is saturated", true, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransformException(operation.kind(), "interrupted while waiting for the result", false, e);
        } catch (Exception e) {
            throw new TransformException(operation.kind(), e.getMessage(), true, e);
        }
    }

    private void discard(Revision revision, RuntimeException cause) {
        try {
            revisionStore.delete(revision);
        } catch (RuntimeException cleanupFailure) {
            cause.addSuppressed(cleanupFailure);
            LoggingUtils.warn(log, cleanupFailure, "Could not delete orphaned revision {}; garbage collection will reclaim it",
                revision.key());
        }
    }

    private final class OperationResolver implements ImageOperation.Visitor<ImageOperation> {

        @Override
        public ImageOperation visitResize(ResizeOperation operation) {
            requireWithinLimit(operation.width(), operation.height());
            return operation;
        }

        @Override
        public ImageOperation visitRotate(RotateOperation operation) {
            return operation;
        }

        @Override
        public ImageOperation visitFlip(FlipOperation operation) {
            return operation;
        }

        @Override
        public ImageOperation visitCompress(CompressOperation operation) {
            return profileCatalog.find(operation.profileId())
                .map(operation::resolvedWith)
                .orElseThrow(() -> new ValidationException("profileId",
                    "Unknown compression profile '" + operation.profileId() + "'"));
        }

        @Override
        public ImageOperation visitRemoveBackground(RemoveBackgroundOperation operation) {
            if (operation.modelId() == null) {
                return new RemoveBackgroundOperation(editProperties.getDefaultBackgroundModel());
            }
            if (!editProperties.getBackgroundModels().contains(operation.modelId())) {
                throw new ValidationException("modelId", "Unknown background removal model '" + operation.modelId()
                    + "'; available: " + editProperties.getBackgroundModels());
            }
            return operation;
        }

        @Override
        public ImageOperation visitAiEdit(AiEditOperation operation) {
            for (AiEditStep step : operation.steps()) {
                if (step instanceof AiEditStep.Resize resize) {
                    requireWithinLimit(resize.width(), resize.height());
                }
            }
            return operation;
        }

        private void requireWithinLimit(int width, int height) {
            int maxDimension = editProperties.getMaxDimension();
            if (width > maxDimension || height > maxDimension) {
                throw new ValidationException("dimensions", "Requested " + width + "x" + height
                    + " exceeds the maximum of " + maxDimension + " pixels per side");
            }
        }
    }

    private final class TransformDispatcher implements ImageOperation.Visitor<PixelData> {

        private final PixelData source;

        private TransformDispatcher(PixelData source) {
            this.source = source;
        }

        @Override
        public PixelData visitResize(ResizeOperation operation) {
            return transformer.resize(source, operation.width(), operation.height());
        }

        @Override
        public PixelData visitRotate(RotateOperation operation) {
            return transformer.rotate(source, operation.normalizedDegrees());
        }

        @Override
        public PixelData visitFlip(FlipOperation operation) {
            return transformer.flip(source, operation.axis());
        }

        @Override
        public PixelData visitCompress(CompressOperation operation) {
            return transformer.compress(source, operation.resolvedProfile());
        }

        @Override
        public PixelData visitRemoveBackground(RemoveBackgroundOperation operation) {
            return transformer.removeBackground(source, operation.modelId());
        }

        @Override
        public PixelData visitAiEdit(AiEditOperation operation) {
            List<AiEditStep> steps = operation.steps();
            return transformer.applyAiSteps(source, steps);
        }
    }
}
