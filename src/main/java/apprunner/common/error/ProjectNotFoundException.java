package apprunner.common.error;

public class ProjectNotFoundException extends AppRunnerException {

    public ProjectNotFoundException(String message) {
        super(ErrorCode.PROJECT_NOT_FOUND, message);
    }

    public static ProjectNotFoundException forProject(String project) {
        return new ProjectNotFoundException("Unable to find project named " + project);
    }
}
