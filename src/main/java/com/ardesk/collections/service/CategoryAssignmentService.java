package com.ardesk.collections.service;

import com.ardesk.collections.model.CustomerCategory;
import com.ardesk.collections.repository.CustomerRepository;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

/**
 * Writes a single customer's category. Each write commits on its own, so an interrupted batch never
 * leaves a half-updated customer behind.
 */
@Service
public class CategoryAssignmentService {

    private final CustomerRepository customerRepository;

    public CategoryAssignmentService(CustomerRepository customerRepository) {
        this.customerRepository = customerRepository;
    }

    /**
     * @return false when nothing was written because the customer is manually overridden, already in
     *         that category, or gone
     */
    @Transactional(propagation = Propagation.REQUIRES_NEW)
    public boolean assign(String tenantId, Long customerId, CustomerCategory category) {
        return customerRepository.updateCategory(tenantId, customerId, category) == 1;
    }
}
