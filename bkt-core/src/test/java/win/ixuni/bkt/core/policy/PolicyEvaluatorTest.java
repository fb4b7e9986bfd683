package win.ixuni.bkt.core.policy;

import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 策略求值测试
 */
public class PolicyEvaluatorTest {

    private final PolicyEvaluator evaluator = new PolicyEvaluator();
    private final PolicyValidator validator = new PolicyValidator();

    private Identity user(PolicyDocument... policies) {
        return Identity.builder()
                .userId("u-1")
                .username("alice")
                .admin(false)
                .policies(List.of(policies))
                .build();
    }

    private PolicyDocument doc(String json) {
        return validator.parse(json);
    }

    @Test
    @DisplayName("显式 Deny 覆盖 Allow")
    void testDenyOverridesAllow() {
        PolicyDocument allowAll = doc("""
                {"Version":"2012-10-17","Statement":[
                  {"Effect":"Allow","Action":"s3:*","Resource":"*"}]}""");
        PolicyDocument denyDelete = doc("""
                {"Version":"2012-10-17","Statement":[
                  {"Effect":"Deny","Action":"s3:DeleteObject","Resource":"arn:aws:s3:::photos/*"}]}""");

        Identity identity = user(allowAll, denyDelete);
        String resource = ResourceArns.object("photos", "2024/cat.jpg");

        assertEquals(PolicyDecision.DENY,
                evaluator.evaluate(identity, PolicyActions.DELETE_OBJECT, resource, identity.getPolicies()));
        assertEquals(PolicyDecision.ALLOW,
                evaluator.evaluate(identity, PolicyActions.GET_OBJECT, resource, identity.getPolicies()));
    }

    @Test
    @DisplayName("Statement order does not change the outcome")
    void testOrderIndependence() {
        PolicyDocument allow = doc("""
                {"Statement":[{"Effect":"Allow","Action":"*","Resource":"*"}]}""");
        PolicyDocument deny = doc("""
                {"Statement":[{"Effect":"Deny","Action":"s3:PutObject","Resource":"*"}]}""");

        List<PolicyDocument> forward = List.of(allow, deny);
        List<PolicyDocument> backward = new ArrayList<>(forward);
        Collections.reverse(backward);

        Identity identity = user();
        String resource = ResourceArns.object("b1", "k");
        assertEquals(PolicyDecision.DENY, evaluator.evaluate(identity, PolicyActions.PUT_OBJECT, resource, forward));
        assertEquals(PolicyDecision.DENY, evaluator.evaluate(identity, PolicyActions.PUT_OBJECT, resource, backward));
    }

    @Test
    @DisplayName("无匹配语句时默认拒绝")
    void testDefaultDeny() {
        PolicyDocument other = doc("""
                {"Statement":[{"Effect":"Allow","Action":"s3:GetObject","Resource":"arn:aws:s3:::other/*"}]}""");

        Identity identity = user(other);
        assertEquals(PolicyDecision.DENY, evaluator.evaluate(identity, PolicyActions.GET_OBJECT,
                ResourceArns.object("mine", "a.txt"), identity.getPolicies()));
        assertEquals(PolicyDecision.DENY, evaluator.evaluate(identity, PolicyActions.GET_OBJECT,
                ResourceArns.object("mine", "a.txt"), List.of()));
        assertEquals(PolicyDecision.DENY, evaluator.evaluate(Identity.anonymous(), PolicyActions.LIST_BUCKET,
                ResourceArns.bucket("mine"), (PolicyDocument) null));
    }

    @Test
    @DisplayName("Admin bypasses every policy, even DenyAll")
    void testAdminBypass() {
        Identity admin = Identity.builder()
                .userId("root")
                .username("root")
                .admin(true)
                .policies(List.of(PolicyTemplates.denyAll()))
                .build();

        assertEquals(PolicyDecision.ALLOW, evaluator.evaluate(admin, PolicyActions.DELETE_BUCKET,
                ResourceArns.bucket("anything"), admin.getPolicies()));
    }

    @Test
    @DisplayName("通配符匹配: action 与 resource 前缀")
    void testWildcardMatching() {
        PolicyDocument getPrefix = doc("""
                {"Statement":[{"Effect":"Allow","Action":["s3:Get*"],"Resource":["arn:aws:s3:::photos/*"]}]}""");
        Identity identity = user(getPrefix);

        assertTrue(evaluator.evaluate(identity, "s3:GetObject",
                ResourceArns.object("photos", "deep/nested/1.jpg"), identity.getPolicies()).isAllowed());
        assertTrue(evaluator.evaluate(identity, "s3:GetBucketLocation",
                ResourceArns.object("photos", "x"), identity.getPolicies()).isAllowed());
        assertFalse(evaluator.evaluate(identity, "s3:PutObject",
                ResourceArns.object("photos", "x"), identity.getPolicies()).isAllowed());
        // bucket ARN itself is not under "photos/*"
        assertFalse(evaluator.evaluate(identity, "s3:GetObject",
                ResourceArns.bucket("photos"), identity.getPolicies()).isAllowed());
        // literal prefix, no path normalization
        assertTrue(evaluator.evaluate(identity, "s3:GetObject",
                ResourceArns.object("photos", "a/../b"), identity.getPolicies()).isAllowed());
    }

    @Test
    @DisplayName("Bucket policy is unioned with user policies")
    void testBucketPolicyUnion() {
        PolicyDocument bucketPolicy = doc("""
                {"Statement":[{"Effect":"Allow","Action":"s3:GetObject","Resource":"arn:aws:s3:::public-site/*"}]}""");
        Identity anonymous = Identity.anonymous();

        assertEquals(PolicyDecision.ALLOW, evaluator.evaluate(anonymous, PolicyActions.GET_OBJECT,
                ResourceArns.object("public-site", "index.html"), bucketPolicy));

        Identity denied = user(PolicyTemplates.denyAll());
        assertEquals(PolicyDecision.DENY, evaluator.evaluate(denied, PolicyActions.GET_OBJECT,
                ResourceArns.object("public-site", "index.html"), bucketPolicy));
    }

    @Test
    @DisplayName("ReadOnly template allows reads only")
    void testReadOnlyTemplate() {
        Identity identity = user(PolicyTemplates.readOnly());
        String resource = ResourceArns.object("b1", "k");

        assertTrue(evaluator.evaluate(identity, PolicyActions.GET_OBJECT, resource, identity.getPolicies()).isAllowed());
        assertTrue(evaluator.evaluate(identity, PolicyActions.LIST_ALL_MY_BUCKETS, ResourceArns.all(),
                identity.getPolicies()).isAllowed());
        assertFalse(evaluator.evaluate(identity, PolicyActions.PUT_OBJECT, resource, identity.getPolicies()).isAllowed());
    }
}
