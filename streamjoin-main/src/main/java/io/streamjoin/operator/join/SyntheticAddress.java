/*
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package io.streamjoin.operator.join;

/**
 * A synthetic address is the location of a buffered row: the high 32 bits hold the
 * index of the page in the buffer, the low 32 bits the position within that page.
 */
final class SyntheticAddress
{
    private SyntheticAddress()
    {
    }

    public static long encodeSyntheticAddress(int pageIndex, int position)
    {
        return (((long) pageIndex) << 32) | position;
    }

    public static int decodePageIndex(long address)
    {
        return (int) (address >> 32);
    }

    public static int decodePosition(long address)
    {
        // low order bits contain the raw offset, so a simple cast here will suffice
        return (int) address;
    }
}
