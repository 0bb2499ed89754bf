package net.imagetools.service.edit;

import net.imagetools.domain.operation.ImageOperation;
import net.imagetools.model.Revision;

/**
 * Result of a successful apply: both objects are stored, nothing is logged yet.
 *
 * @param revision stored result
 * @param thumbnail stored thumbnail of {@code revision}
 * @param recordedOperation operation to log, with defaults and profile snapshots filled in
 */
public record AppliedOperation(Revision revision, Revision thumbnail, ImageOperation recordedOperation) {
}
