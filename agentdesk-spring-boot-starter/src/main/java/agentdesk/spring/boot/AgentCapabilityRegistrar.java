package agentdesk.spring.boot;

import agentdesk.AgentHandler;
import agentdesk.registry.DefaultAgentRegistry;
import org.springframework.beans.factory.BeanCreationException;
import org.springframework.beans.factory.ListableBeanFactory;
import org.springframework.beans.factory.SmartInitializingSingleton;

import java.util.Map;

/**
 * Scans for beans annotated with {@link AgentCapability} and registers them in the
 * {@link DefaultAgentRegistry}.
 *
 * <p>Runs after all singleton beans are initialized via {@link SmartInitializingSingleton}.
 *
 * @see AgentCapability
 */
public class AgentCapabilityRegistrar implements SmartInitializingSingleton {

    private final ListableBeanFactory beanFactory;
    private final DefaultAgentRegistry registry;

    public AgentCapabilityRegistrar(ListableBeanFactory beanFactory, DefaultAgentRegistry registry) {
        this.beanFactory = beanFactory;
        this.registry = registry;
    }

    @Override
    public void afterSingletonsInstantiated() {
        Map<String, Object> beans = beanFactory.getBeansWithAnnotation(AgentCapability.class);
        for (Map.Entry<String, Object> entry : beans.entrySet()) {
            String beanName = entry.getKey();
            Object bean = entry.getValue();

            if (!(bean instanceof AgentHandler handler)) {
                throw new BeanCreationException(beanName,
                        "Bean annotated with @AgentCapability must implement AgentHandler, " +
                                "but " + bean.getClass().getName() + " does not");
            }

            AgentCapability annotation = beanFactory.findAnnotationOnBean(beanName, AgentCapability.class);
            if (annotation == null) {
                throw new BeanCreationException(beanName,
                        "Could not find @AgentCapability annotation on " + bean.getClass().getName());
            }
            if (annotation.name().isBlank()) {
                throw new BeanCreationException(beanName, "@AgentCapability name must not be blank");
            }

            registry.register(annotation.name(), annotation.description(), handler);
        }
    }
}
