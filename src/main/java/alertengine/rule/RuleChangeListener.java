package alertengine.rule;

/**
 * 规则变更监听器接口
 */
public interface RuleChangeListener {
    void onRuleAdded(Rule rule);

    void onRuleUpdated(Rule previous, Rule rule);

    void onRuleDeleted(Rule rule);

    void onRuleLoadError(RuleRejection rejection);
}
