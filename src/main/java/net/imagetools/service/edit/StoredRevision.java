package net.imagetools.service.edit;

import net.imagetools.model.Revision;

/**
 * A revision and its thumbnail, written together.
 */
public record StoredRevision(Revision revision, Revision thumbnail) {
}
