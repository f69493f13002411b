package com.queryguard.rule;

import java.util.Set;

/**
 * 内置白名单数据。只有数据，没有逻辑；配置中的扩展项在此基础上追加，不能删减。
 */
public final class DefaultWhitelists {

    private DefaultWhitelists() {
    }

    // ==================== JQL ====================

    public static final Set<String> JQL_FIELDS = Set.of(
            // Jira 标准字段
            "project", "issuetype", "status", "priority", "assignee", "reporter",
            "created", "updated", "resolved", "summary", "description", "labels",
            "components", "fixVersion", "affectedVersion", "environment", "resolution",
            "key", "duedate", "originalEstimate", "remainingEstimate", "timeSpent",
            "worklogDate", "lastViewed", "voter", "watcher", "comment", "attachment",
            "issue", "issuekey", "parent", "text", "sprint", "creator",
            // Xray 测试管理字段
            "testType", "testPlan", "testExecution", "testEnvironment", "testSet",
            "testRun", "testCycle", "requirement", "defect",
            "testStatus", "executedBy", "executionDate", "testResult", "testRunStatus",
            "testExecutionStatus", "lastTestResult", "testPlanStatus", "testSetStatus",
            "coveredRequirement", "testFolder", "testRepository",
            "testVersion", "testVersionDate", "testHistory",
            "testConfiguration", "testEnvironmentName", "testBrowser", "testPlatform", "testDevice",
            // Cucumber / BDD
            "scenario", "feature", "gherkinType",
            "testSuite", "testGroup", "testCategory");

    public static final Set<String> JQL_FUNCTIONS = Set.of(
            "currentUser", "currentLogin", "membersOf", "now",
            "startOfDay", "endOfDay", "startOfWeek", "endOfWeek",
            "startOfMonth", "endOfMonth", "startOfYear", "endOfYear",
            "startOfQuarter", "endOfQuarter",
            "earliestUnreleasedVersion", "latestReleasedVersion",
            "releasedVersions", "unreleasedVersions",
            // Xray
            "testExecutedBy", "testLastExecutedBy", "testExecutedIn", "testPlanFor",
            "testSetFor", "testCovering", "testCoveredBy", "testExecutedInBuild",
            "testExecutedInVersion", "testResultStatus", "testLastResultStatus",
            "testExecutionEnvironment", "testRunEnvironment", "testInFolder",
            "testInRepository", "testOfType",
            "linkedTests", "linkedRequirements", "linkedDefects", "childTests", "parentTests",
            "testExecutedOnDate", "testExecutedBetween", "testNotExecutedSince",
            "testWithResult", "testInPlan", "testInSet", "testInExecution",
            "affectedVersion", "fixVersion", "testTargetVersion");

    /** JQL 关键字，包括组合运算符中的单词（not in / is not / was not in ...） */
    public static final Set<String> JQL_KEYWORDS = Set.of(
            "and", "or", "not", "empty", "null", "order", "by", "asc", "desc",
            "in", "is", "was", "changed");

    // ==================== GraphQL ====================

    public static final Set<String> GRAPHQL_QUERIES = Set.of(
            "getTest", "getTests", "getTestExecution", "getTestExecutions",
            "getTestSet", "getTestSets", "getTestPlan", "getTestPlans",
            "getTestRun", "getTestRuns", "getPrecondition", "getPreconditions",
            "getTestRepository", "getTestRepositoryFolders", "getDataset",
            "getTestStatus", "getTestHistory", "getCoverableIssues",
            "getTestTypes", "getTestEnvironments", "getTestVersions");

    public static final Set<String> GRAPHQL_MUTATIONS = Set.of(
            "createTest", "updateTest", "deleteTest",
            "createTestExecution", "updateTestExecution", "deleteTestExecution",
            "addTestsToTestExecution", "removeTestsFromTestExecution",
            "createTestSet", "updateTestSet", "deleteTestSet",
            "addTestsToTestSet", "removeTestsFromTestSet",
            "createTestPlan", "updateTestPlan", "deleteTestPlan",
            "addTestsToTestPlan", "removeTestsFromTestPlan",
            "createTestRun", "updateTestRun", "deleteTestRun",
            "createPrecondition", "updatePrecondition", "deletePrecondition",
            "updateGherkinDefinition", "moveTestToFolder");

    public static final Set<String> GRAPHQL_FIELDS = Set.of(
            // 通用
            "issueId", "projectId", "issueType", "jira", "key", "summary",
            "description", "status", "priority", "assignee", "reporter",
            "created", "updated", "resolved", "labels", "components",
            // 测试
            "test", "testIssueFields", "testType", "testRepository", "folder", "gherkin", "unstructured",
            "steps", "preconditions", "datasets", "versions", "testResults",
            "lastTestResult", "testStatus", "testEnvironments",
            // 测试执行
            "testExecution", "testExecutionStatus", "executedBy", "executionDate",
            "testRun", "testRunStatus", "environment",
            // 测试组织
            "testSet", "testPlan", "testPlans", "testSets", "tests",
            "totalTests", "passedTests", "failedTests", "blockedTests",
            // 分页与元数据
            "total", "start", "limit", "results", "warnings", "errors",
            "startAt", "maxResults", "isLast", "values",
            // 嵌套对象
            "name", "kind", "id", "displayName", "emailAddress", "active",
            "accountId", "self", "avatarUrls", "timeZone",
            // 版本与历史
            "version", "versionId", "versionNumber", "createdOn", "lastModified",
            "customFields", "customfield_10001", "customfield_10002",
            "customfield_10003", "customfield_10004", "customfield_10005",
            // 客户端缓存需要
            "__typename");

    /** GraphQL 结构关键字，区分大小写 */
    public static final Set<String> GRAPHQL_KEYWORDS = Set.of(
            "query", "mutation", "fragment", "on", "true", "false", "null");

    /** 大写开头的名称按类型 / 枚举引用宽松放行，但不能包含这些片段 */
    public static final Set<String> SUSPICIOUS_NAME_PARTS = Set.of("evil", "hack", "script");
}
