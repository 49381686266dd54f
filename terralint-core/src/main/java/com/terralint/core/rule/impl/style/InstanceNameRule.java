package com.terralint.core.rule.impl.style;

import com.terralint.core.model.Block;
import com.terralint.core.model.BlockKind;
import com.terralint.core.model.RuleCategory;
import com.terralint.core.model.Severity;
import com.terralint.core.rule.FileContext;
import com.terralint.core.rule.ViolationSink;
import com.terralint.core.rule.base.AbstractFileRule;

/**
 * ST.001: resource and data source instance names must be the configured instance name.
 *
 * <p>Test configurations name every instance {@code test} so that references read the same
 * across examples: {@code huaweicloud_vpc.test.id}. The expected name comes from
 * {@code naming.instanceName}.</p>
 *
 * <p><b>Example:</b>
 * <pre>{@code
 * resource "huaweicloud_vpc" "test" { ... }    # ok
 * data "huaweicloud_vpcs" "main" { ... }       # ST.001
 * }</pre>
 *
 * @since 1.0.0
 */
public class InstanceNameRule extends AbstractFileRule {

    public static final String RULE_ID = "ST.001";
    private static final String DISPLAY_NAME = "Resource and data source naming";

    @Override
    public String getId() {
        return RULE_ID;
    }

    @Override
    public String getDisplayName() {
        return DISPLAY_NAME;
    }

    @Override
    public RuleCategory getCategory() {
        return RuleCategory.ST;
    }

    @Override
    public Severity getSeverity() {
        return Severity.ERROR;
    }

    @Override
    public boolean appliesTo(FileContext context) {
        return isConfigurationFile(context);
    }

    @Override
    public void check(FileContext context, ViolationSink sink) {
        String expected = context.settings().instanceName();
        for (Block block : context.root().children()) {
            if (block.kind() != BlockKind.RESOURCE && block.kind() != BlockKind.DATA) {
                continue;
            }
            String type = block.typeLabel().orElse(null);
            String name = block.nameLabel().orElse(null);
            if (type == null || name == null || name.equals(expected)) {
                continue;
            }
            String noun = block.kind() == BlockKind.DATA ? "Data source" : "Resource";
            sink.report(context.path(), block.startLine(),
                noun + " '" + type + "' instance name '" + name + "' should be '" + expected + "'");
        }
    }
}
