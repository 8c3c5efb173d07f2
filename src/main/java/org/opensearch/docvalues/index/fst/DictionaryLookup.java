/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.opensearch.docvalues.index.fst;

import org.apache.lucene.util.BytesRef;
import org.apache.lucene.util.BytesRefBuilder;
import org.apache.lucene.util.fst.FST;

import java.io.IOException;

/**
 * Reverse lookup from an ordinal to its term in an {@link FST} whose outputs are the term ordinals.
 *
 * Outputs grow along every path and between siblings, so at each node the walk follows the last arc
 * whose accumulated output does not exceed the target. Keeps its scratch arcs and term buffer
 * across calls, so one instance serves one thread.
 */
public final class DictionaryLookup {

    private final FST<Long> fst;
    private final FST.BytesReader in;
    private final FST.Arc<Long> arc = new FST.Arc<>();
    private final FST.Arc<Long> scratchArc = new FST.Arc<>();
    private final BytesRefBuilder term = new BytesRefBuilder();

    public DictionaryLookup(FST<Long> fst) {
        this.fst = fst;
        this.in = fst.getBytesReader();
    }

    /**
     * Finds the term whose accumulated output equals {@code ordinal}.
     *
     * @return the term, valid until the next call, or {@code null} if no term has this ordinal
     */
    public BytesRef termOf(long ordinal) throws IOException {
        fst.getFirstArc(arc);
        long output = arc.output();
        int upto = 0;
        while (true) {
            if (arc.isFinal()) {
                long finalOutput = output + arc.nextFinalOutput();
                if (finalOutput == ordinal) {
                    term.setLength(upto);
                    return term.get();
                } else if (finalOutput > ordinal) {
                    return null;
                }
            }
            if (FST.targetHasArcs(arc) == false) {
                return null;
            }
            term.grow(upto + 1);
            fst.readFirstRealTargetArc(arc.target(), arc, in);
            FST.Arc<Long> prevArc = null;
            while (true) {
                long minArcOutput = output + arc.output();
                if (minArcOutput == ordinal || (minArcOutput < ordinal && arc.isLast())) {
                    output = minArcOutput;
                    term.setByteAt(upto++, (byte) arc.label());
                    break;
                } else if (minArcOutput > ordinal) {
                    if (prevArc == null) {
                        return null;
                    }
                    arc.copyFrom(prevArc);
                    output += arc.output();
                    term.setByteAt(upto++, (byte) arc.label());
                    break;
                } else {
                    prevArc = scratchArc.copyFrom(arc);
                    fst.readNextRealArc(arc, in);
                }
            }
        }
    }
}
