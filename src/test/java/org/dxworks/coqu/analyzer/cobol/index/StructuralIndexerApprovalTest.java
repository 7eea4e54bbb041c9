package org.dxworks.coqu.analyzer.cobol.index;

import org.approvaltests.Approvals;
import org.dxworks.coqu.TestUtils;
import org.dxworks.coqu.model.index.StructuralIndex;
import org.junit.jupiter.api.Test;

public class StructuralIndexerApprovalTest {

    @Test
    void index_BasicProgram() throws Exception {
        StructuralIndex index = new StructuralIndexer().index(TestUtils.readSample("basic-program.cbl"));
        Approvals.verify(TestUtils.APPROVAL_MAPPER.writeValueAsString(index));
    }
}
