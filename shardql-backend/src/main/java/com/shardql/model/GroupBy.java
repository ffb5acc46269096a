package com.shardql.model;

import com.shardql.engine.DatasetKeyNormalizer;

/**
 * Which dimension of a (dataset, table) pair becomes the outer key of an aggregate.
 */
public enum GroupBy {
    BY_DATASET {
        @Override
        public String outerKey(FetchUnit unit, DatasetKeyNormalizer normalizer) {
            return normalizer.normalize(unit.getDataset());
        }

        @Override
        public String innerKey(FetchUnit unit, DatasetKeyNormalizer normalizer) {
            return unit.getTable();
        }
    },
    BY_TABLE {
        @Override
        public String outerKey(FetchUnit unit, DatasetKeyNormalizer normalizer) {
            return unit.getTable();
        }

        @Override
        public String innerKey(FetchUnit unit, DatasetKeyNormalizer normalizer) {
            return normalizer.normalize(unit.getDataset());
        }
    };

    public abstract String outerKey(FetchUnit unit, DatasetKeyNormalizer normalizer);

    public abstract String innerKey(FetchUnit unit, DatasetKeyNormalizer normalizer);
}
