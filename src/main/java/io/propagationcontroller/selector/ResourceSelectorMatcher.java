package io.propagationcontroller.selector;

import io.propagationcontroller.models.LabelSelector;
import io.propagationcontroller.models.PropagationSpec;
import io.propagationcontroller.models.ResourceDescriptor;
import io.propagationcontroller.models.ResourceSelector;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Matches resources from the resource inventory against a policy's resource selectors.
 * 
 * Stateless: a single instance can be shared by concurrent evaluations.
 */
@Slf4j
public class ResourceSelectorMatcher {
    
    private static final Comparator<ResourceDescriptor> RESOURCE_ORDER = Comparator
        .comparing(ResourceDescriptor::getApiVersion, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(ResourceDescriptor::getKind, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(ResourceDescriptor::getNamespace, Comparator.nullsFirst(Comparator.naturalOrder()))
        .thenComparing(ResourceDescriptor::getName, Comparator.nullsFirst(Comparator.naturalOrder()));
    
    /**
     * Check whether a resource is selected by a selector.
     * 
     * A resource matches iff apiVersion and kind are equal, its name is allowed by names (when non-empty),
     * its namespace is allowed by namespaces (when non-empty) and not listed in excludeNamespaces,
     * and the label selector, when present, matches its labels.
     */
    public boolean matches(ResourceDescriptor resource, ResourceSelector selector) {
        if (!Objects.equals(selector.getApiVersion(), resource.getApiVersion())
            || !Objects.equals(selector.getKind(), resource.getKind())) {
            return false;
        }
        
        if (isSet(selector.getNames()) && !selector.getNames().contains(resource.getName())) {
            return false;
        }
        
        String namespace = resource.getNamespace() != null ? resource.getNamespace() : "";
        if (isSet(selector.getNamespaces()) && !selector.getNamespaces().contains(namespace)) {
            return false;
        }
        if (isSet(selector.getExcludeNamespaces()) && selector.getExcludeNamespaces().contains(namespace)) {
            return false;
        }
        
        Optional<LabelSelector> labelSelector = selector.findLabelSelector();
        if (labelSelector.isEmpty() || labelSelector.get().isEmpty()) {
            return true;
        }
        
        Map<String, String> labels = resource.getLabels();
        if (labels == null || labels.isEmpty()) {
            // An unlabeled resource only satisfies an absent or empty selector
            return false;
        }
        return LabelSelectorMatcher.matches(labelSelector.get(), labels);
    }
    
    /**
     * Select resources for a policy.
     * 
     * A null selector list selects every resource, an empty list selects none, otherwise a resource
     * is selected when any selector matches it. The result is de-duplicated and sorted by
     * apiVersion, kind, namespace and name.
     */
    public List<ResourceDescriptor> matchResources(PropagationSpec spec, List<ResourceDescriptor> resources) {
        List<ResourceSelector> selectors = spec.getResourceSelectors();
        Set<ResourceDescriptor> matched = new LinkedHashSet<>();
        
        if (selectors == null) {
            log.debug("No resource selectors declared, selecting all {} resources", resources.size());
            matched.addAll(resources);
        } else {
            for (ResourceDescriptor resource : resources) {
                for (ResourceSelector selector : selectors) {
                    if (matches(resource, selector)) {
                        matched.add(resource);
                        break;
                    }
                }
            }
        }
        
        List<ResourceDescriptor> result = new ArrayList<>(matched);
        result.sort(RESOURCE_ORDER);
        
        log.debug("Matched {} of {} resources against {} selectors", 
                 result.size(), resources.size(), selectors == null ? "all" : selectors.size());
        return result;
    }
    
    private static boolean isSet(List<String> values) {
        return values != null && !values.isEmpty();
    }
}
