package com.example.organizationservice.repository;

import com.example.organizationservice.filter.QueryFilter;
import com.example.organizationservice.pagination.Page;
import com.example.organizationservice.pagination.PaginationInfo;
import com.example.organizationservice.specification.CriteriaSpecificationTranslator;
import com.example.organizationservice.specification.FieldSpecification;
import com.example.organizationservice.specification.SortSpecification;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;
import jakarta.persistence.criteria.CriteriaBuilder;
import jakarta.persistence.criteria.CriteriaQuery;
import jakarta.persistence.criteria.Predicate;
import jakarta.persistence.criteria.Root;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Read side shared by every entity: lowers field specifications, filters and
 * sorts into a Criteria query and executes it.
 *
 * Specifications are AND-ed first, then each filter is AND-ed in order.
 *
 * @param <E> entity type
 */
public abstract class SpecificationQueryRepository<E> {

    private final Class<E> entityClass;

    @PersistenceContext
    private EntityManager entityManager;

    protected SpecificationQueryRepository(Class<E> entityClass) {
        this.entityClass = entityClass;
    }

    public List<E> getList(Collection<? extends FieldSpecification<E, ?>> specifications,
                           Collection<? extends QueryFilter<E>> filters,
                           Collection<SortSpecification> sorts,
                           PaginationInfo pagination) {
        if (pagination != null && pagination.isBeyondAddressableRows()) {
            return List.of();
        }
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<E> query = cb.createQuery(entityClass);
        Root<E> root = query.from(entityClass);

        query.select(root).where(buildWhere(root, query, cb, specifications, filters));
        query.orderBy(CriteriaSpecificationTranslator.toOrders(root, cb, sorts));

        TypedQuery<E> typedQuery = entityManager.createQuery(query);
        if (pagination != null && pagination.isLimited()) {
            typedQuery.setFirstResult((int) pagination.offset());
            typedQuery.setMaxResults(pagination.perPage());
        }
        return typedQuery.getResultList();
    }

    public List<E> getList(Collection<? extends FieldSpecification<E, ?>> specifications) {
        return getList(specifications, List.of(), List.of(), null);
    }

    public long getCount(Collection<? extends FieldSpecification<E, ?>> specifications,
                         Collection<? extends QueryFilter<E>> filters) {
        CriteriaBuilder cb = entityManager.getCriteriaBuilder();
        CriteriaQuery<Long> query = cb.createQuery(Long.class);
        Root<E> root = query.from(entityClass);

        query.select(cb.count(root)).where(buildWhere(root, query, cb, specifications, filters));
        return entityManager.createQuery(query).getSingleResult();
    }

    public long getCount(Collection<? extends FieldSpecification<E, ?>> specifications) {
        return getCount(specifications, List.of());
    }

    /**
     * Page of rows plus the total count for the same specifications and filters.
     */
    public Page<E> getPage(Collection<? extends FieldSpecification<E, ?>> specifications,
                           Collection<? extends QueryFilter<E>> filters,
                           Collection<SortSpecification> sorts,
                           PaginationInfo pagination) {
        List<E> items = getList(specifications, filters, sorts, pagination);
        long total = getCount(specifications, filters);
        return new Page<>(items, total, pagination.page(), pagination.perPage());
    }

    private Predicate[] buildWhere(Root<E> root,
                                   CriteriaQuery<?> query,
                                   CriteriaBuilder cb,
                                   Collection<? extends FieldSpecification<E, ?>> specifications,
                                   Collection<? extends QueryFilter<E>> filters) {
        List<Predicate> predicates = new ArrayList<>(
                CriteriaSpecificationTranslator.toPredicates(root, cb, specifications));
        if (filters != null) {
            for (QueryFilter<E> filter : filters) {
                predicates.add(filter.toPredicate(root, query, cb));
            }
        }
        return predicates.toArray(new Predicate[0]);
    }
}
