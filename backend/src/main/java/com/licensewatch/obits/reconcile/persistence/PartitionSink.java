package com.licensewatch.obits.reconcile.persistence;

import com.licensewatch.obits.reconcile.model.PartitionedRow;

import java.io.Closeable;
import java.util.List;

/**
 * Destination for the kept and removed streams. Rows arrive in input order, one batch at
 * a time, and must be durable when the call returns.
 */
public interface PartitionSink extends Closeable {

    void writeKept(List<PartitionedRow> rows);

    void writeRemoved(List<PartitionedRow> rows);
}
